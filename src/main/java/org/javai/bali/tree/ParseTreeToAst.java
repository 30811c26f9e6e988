package org.javai.bali.tree;

import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.parse.BdnToken;
import org.javai.bali.parse.GrammarRule;
import org.javai.bali.parse.ParseElement;
import org.javai.bali.parse.ParseNode;
import org.javai.bali.parse.TokenType;

/**
 * Builds the AST from a concrete parse tree.
 * <p>
 * Surface variants (inline, newline or empty collections) collapse to one tree shape. While
 * descending into the items of arrays, tables and procedures a depth is tracked so that the
 * indentation of multi-line text and binary literals can be removed from their values.
 * <p>
 * Instances keep the depth while converting and must not be shared between threads.
 */
public class ParseTreeToAst {

	private final int indentation;
	private int depth = 0;

	public ParseTreeToAst() {
		this(BdnOptions.defaults());
	}

	public ParseTreeToAst(BdnOptions options) {
		this.indentation = options.indentation();
	}

	/**
	 * Converts a parse tree rooted at any rule an entry point of the grammar parser returns.
	 */
	public BdnNode convert(ParseNode node) {
		depth = 0;
		return visit(node);
	}

	private BdnNode visit(ParseNode node) {
		return switch (node.rule()) {
			case DOCUMENT, COMPONENT, COMPONENT_EXPRESSION -> visit(node.node(0));
			case TASK -> task(node);
			case ELEMENT -> element(node);
			case STRUCTURE -> parameterized(NodeType.STRUCTURE, node);
			case BLOCK -> parameterized(NodeType.BLOCK, node);
			case PARAMETERS -> Tree.builder(NodeType.PARAMETERS).add(visit(node.node(0))).build();
			case RANGE -> children(Tree.builder(NodeType.RANGE), node).build();
			case ARRAY -> collection(NodeType.ARRAY, node);
			case TABLE -> collection(NodeType.TABLE, node);
			case PROCEDURE -> collection(NodeType.PROCEDURE, node);
			case ASSOCIATION -> children(Tree.builder(NodeType.ASSOCIATION), node).build();
			case STATEMENT -> statement(node);
			case EVALUATE_CLAUSE -> evaluateClause(node);
			case CHECKOUT_CLAUSE -> symbolClause(NodeType.CHECKOUT_CLAUSE, node);
			case WAIT_CLAUSE -> symbolClause(NodeType.WAIT_CLAUSE, node);
			case SAVE_CLAUSE -> children(Tree.builder(NodeType.SAVE_CLAUSE), node).build();
			case DISCARD_CLAUSE -> children(Tree.builder(NodeType.DISCARD_CLAUSE), node).build();
			case COMMIT_CLAUSE -> children(Tree.builder(NodeType.COMMIT_CLAUSE), node).build();
			case PUBLISH_CLAUSE -> children(Tree.builder(NodeType.PUBLISH_CLAUSE), node).build();
			case QUEUE_CLAUSE -> children(Tree.builder(NodeType.QUEUE_CLAUSE), node).build();
			case THROW_CLAUSE -> children(Tree.builder(NodeType.THROW_CLAUSE), node).build();
			case IF_CLAUSE -> children(Tree.builder(NodeType.IF_CLAUSE), node).build();
			case SELECT_CLAUSE -> children(Tree.builder(NodeType.SELECT_CLAUSE), node).build();
			case FINISH_CLAUSE -> children(Tree.builder(NodeType.FINISH_CLAUSE), node).build();
			case HANDLE_CLAUSE -> symbolClause(NodeType.HANDLE_CLAUSE, node);
			case WHILE_CLAUSE -> loop(NodeType.WHILE_CLAUSE, node);
			case WITH_CLAUSE -> loop(NodeType.WITH_CLAUSE, node);
			case CONTINUE_CLAUSE -> loop(NodeType.CONTINUE_CLAUSE, node);
			case BREAK_CLAUSE -> loop(NodeType.BREAK_CLAUSE, node);
			case RETURN_CLAUSE -> {
				Tree.Builder builder = children(Tree.builder(NodeType.RETURN_CLAUSE), node);
				yield node.nodes().isEmpty() ? builder.build() : builder.weigh(1).build();
			}
			case VARIABLE_EXPRESSION -> new Terminal(NodeType.VARIABLE, node.token(TokenType.IDENTIFIER).text());
			case FUNCTION_EXPRESSION -> invocation(Tree.builder(NodeType.FUNCTION_EXPRESSION), node.node(0)).build();
			case MESSAGE_EXPRESSION -> invocation(
					Tree.builder(NodeType.MESSAGE_EXPRESSION).add(visit(node.node(0))), node.node(1))
					.operator(node.token(TokenType.DOT).text())
					.build();
			case PRECEDENCE_EXPRESSION -> children(Tree.builder(NodeType.PRECEDENCE_EXPRESSION), node).build();
			case MAGNITUDE_EXPRESSION -> children(Tree.builder(NodeType.MAGNITUDE_EXPRESSION), node).build();
			case DEREFERENCE_EXPRESSION -> operation(NodeType.DEREFERENCE_EXPRESSION, node);
			case INVERSION_EXPRESSION -> operation(NodeType.INVERSION_EXPRESSION, node);
			case COMPLEMENT_EXPRESSION -> operation(NodeType.COMPLEMENT_EXPRESSION, node);
			case FACTORIAL_EXPRESSION -> operation(NodeType.FACTORIAL_EXPRESSION, node);
			case EXPONENTIAL_EXPRESSION -> operation(NodeType.EXPONENTIAL_EXPRESSION, node);
			case ARITHMETIC_EXPRESSION -> operation(NodeType.ARITHMETIC_EXPRESSION, node);
			case COMPARISON_EXPRESSION -> operation(NodeType.COMPARISON_EXPRESSION, node);
			case LOGICAL_EXPRESSION -> operation(NodeType.LOGICAL_EXPRESSION, node);
			case DEFAULT_EXPRESSION -> operation(NodeType.DEFAULT_EXPRESSION, node);
			case SUBCOMPONENT_EXPRESSION -> children(Tree.builder(NodeType.SUBCOMPONENT_EXPRESSION), node).build();
			case INDICES -> Tree.builder(NodeType.INDICES).add(visit(node.node(0))).build();
			case RECIPIENT, INVOCATION, NUMBER, REAL, IMAGINARY, PERCENT, TEXT, BINARY ->
					throw new IllegalStateException(node.rule() + " is converted by its enclosing rule");
		};
	}

	/**
	 * Adds every child rule node, in order.
	 */
	private Tree.Builder children(Tree.Builder builder, ParseNode node) {
		for (ParseNode child : node.nodes()) {
			builder.add(visit(child));
		}
		return builder;
	}

	private Tree operation(NodeType type, ParseNode node) {
		String operator = node.tokens().get(0).text();
		return children(Tree.builder(type), node).operator(operator).build();
	}

	private Tree.Builder invocation(Tree.Builder builder, ParseNode invocation) {
		return builder
				.add(new Terminal(NodeType.NAME, invocation.token(TokenType.IDENTIFIER).text()))
				.add(visit(invocation.node(0)));
	}

	/**
	 * Statements of a task are written flush left, so its procedure sits one level above the root.
	 */
	private Tree task(ParseNode node) {
		Terminal shell = new Terminal(NodeType.SHELL, node.token(TokenType.SHELL).text());
		depth--;
		BdnNode procedure = visit(node.node(0));
		depth++;
		return Tree.builder(NodeType.TASK).add(shell).add(procedure).build();
	}

	/**
	 * Each item adds two to the size; the depth is one deeper while the items are converted.
	 */
	private Tree collection(NodeType type, ParseNode node) {
		Tree.Builder builder = Tree.builder(type);
		depth++;
		for (ParseNode item : node.nodes()) {
			builder.add(visit(item)).weigh(2);
		}
		depth--;
		return builder.build();
	}

	private BdnNode parameterized(NodeType type, ParseNode node) {
		return children(Tree.builder(type), node).build();
	}

	private Tree statement(ParseNode node) {
		Tree.Builder builder = Tree.builder(NodeType.STATEMENT);
		for (ParseNode clause : node.nodes()) {
			builder.add(visit(clause));
			if (clause.rule() == GrammarRule.HANDLE_CLAUSE) {
				builder.weigh(1);
			}
		}
		return builder.build();
	}

	private Tree evaluateClause(ParseNode node) {
		Tree.Builder builder = Tree.builder(NodeType.EVALUATE_CLAUSE);
		for (ParseNode child : node.nodes()) {
			if (child.rule() == GrammarRule.RECIPIENT) {
				builder.add(recipient(child)).weigh(4);
			} else {
				builder.add(visit(child));
			}
		}
		return builder.build();
	}

	private BdnNode recipient(ParseNode recipient) {
		BdnToken symbol = recipient.token(TokenType.SYMBOL);
		if (symbol != null) {
			return new Terminal(NodeType.SYMBOL, symbol.text());
		}
		return Tree.builder(NodeType.SUBCOMPONENT_EXPRESSION)
				.add(new Terminal(NodeType.VARIABLE, recipient.token(TokenType.IDENTIFIER).text()))
				.add(visit(recipient.node(0)))
				.build();
	}

	/**
	 * Clauses whose first operand is a symbol token: checkout, wait and handle.
	 */
	private Tree symbolClause(NodeType type, ParseNode node) {
		Tree.Builder builder = Tree.builder(type)
				.add(new Terminal(NodeType.SYMBOL, node.token(TokenType.SYMBOL).text()));
		return children(builder, node).build();
	}

	/**
	 * Clauses that may name a label: while, with, continue and break. A with clause may also
	 * bind an item symbol.
	 */
	private Tree loop(NodeType type, ParseNode node) {
		Tree.Builder builder = Tree.builder(type);
		BdnToken label = node.token(TokenType.IDENTIFIER);
		if (label != null) {
			builder.add(new Terminal(NodeType.LABEL, label.text()));
		}
		BdnToken item = node.token(TokenType.SYMBOL);
		if (item != null) {
			builder.add(new Terminal(NodeType.SYMBOL, item.text()));
		}
		return children(builder, node).build();
	}

	// elements

	private BdnNode element(ParseNode node) {
		BdnNode value = elementValue(node.children().get(0));
		if (!node.hasNode(GrammarRule.PARAMETERS)) {
			return value;
		}
		return Tree.builder(NodeType.COMPONENT)
				.add(value)
				.add(visit(node.nodes(GrammarRule.PARAMETERS).get(0)))
				.build();
	}

	private Terminal elementValue(ParseElement value) {
		if (value instanceof BdnToken token) {
			return new Terminal(terminalType(token.type()), token.text());
		}
		ParseNode node = (ParseNode) value;
		return switch (node.rule()) {
			case NUMBER -> new Terminal(NodeType.NUMBER, number(node));
			case PERCENT -> new Terminal(NodeType.PERCENT, node.node(0).text() + "%");
			case TEXT -> new Terminal(NodeType.TEXT, stripIndentation(node.tokens().get(0).text()));
			case BINARY -> new Terminal(NodeType.BINARY, stripIndentation(node.tokens().get(0).text()));
			default -> throw new IllegalStateException("Unexpected element rule: " + node.rule());
		};
	}

	private static NodeType terminalType(TokenType type) {
		return switch (type) {
			case TRUE, FALSE, FRACTION -> NodeType.PROBABILITY;
			case NONE, ANY -> NodeType.TEMPLATE;
			case TAG -> NodeType.TAG;
			case SYMBOL -> NodeType.SYMBOL;
			case MOMENT -> NodeType.MOMENT;
			case DURATION -> NodeType.DURATION;
			case RESOURCE -> NodeType.REFERENCE;
			case VERSION -> NodeType.VERSION;
			default -> throw new IllegalStateException("Unexpected element token: " + type);
		};
	}

	/**
	 * Canonical number text: {@code 5}, {@code -pi}, {@code 3i}, {@code pi i}, {@code -i},
	 * {@code (1, 2i)} or {@code (1 e^pi i)}.
	 */
	private static String number(ParseNode number) {
		return switch (number.variant()) {
			case REAL -> number.node(0).text();
			case IMAGINARY -> imaginary(number.node(0));
			case RECTANGULAR -> "(" + number.node(0).text() + ", " + imaginary(number.node(1)) + ")";
			case POLAR -> "(" + number.node(0).text() + " e^" + imaginary(number.node(1)) + ")";
			default -> number.tokens().get(0).text();
		};
	}

	private static String imaginary(ParseNode imaginary) {
		List<ParseNode> reals = imaginary.nodes(GrammarRule.REAL);
		if (!reals.isEmpty()) {
			ParseNode real = reals.get(0);
			String separator = real.hasToken(TokenType.CONSTANT) ? " " : "";
			return real.text() + separator + "i";
		}
		return imaginary.hasToken(TokenType.MINUS) ? "-i" : "i";
	}

	private String stripIndentation(String literal) {
		if (depth <= 0) {
			return literal;
		}
		return literal.replace("\n" + StringUtils.repeat(' ', depth * indentation), "\n");
	}
}
