package org.javai.bali.format;

import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.BdnNodeVisitor;
import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Terminal;
import org.javai.bali.tree.Tree;

/**
 * Emits canonical Bali Document Notation source for an AST.
 * <p>
 * Parsing the output yields an AST equal to the input, and canonical source survives a
 * parse-format cycle byte for byte. Arrays, tables and parameters stay on one line while their
 * size is at most {@link BdnOptions#maxInlineSize()}; procedures always put one statement per line.
 *
 * <pre>
 * BdnFormatter formatter = new BdnFormatter();
 * String source = formatter.formatDocument(node);
 * </pre>
 */
public class BdnFormatter {

	private final BdnOptions options;

	public BdnFormatter() {
		this(BdnOptions.defaults());
	}

	public BdnFormatter(BdnOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("Options cannot be null");
		}
		this.options = options;
	}

	/**
	 * Formats a node of any kind, without a trailing line break.
	 */
	public String format(BdnNode node) {
		Emitter emitter = new Emitter(node.type() == NodeType.TASK ? -1 : 0);
		node.accept(emitter);
		return emitter.output.toString();
	}

	/**
	 * Formats a whole document, which always ends with a line break.
	 */
	public String formatDocument(BdnNode node) {
		String text = format(node);
		return text.endsWith("\n") ? text : text + "\n";
	}

	private final class Emitter implements BdnNodeVisitor<Void> {

		private final StringBuilder output = new StringBuilder();
		private int depth;

		private Emitter(int depth) {
			this.depth = depth;
		}

		@Override
		public Void visitTerminal(Terminal terminal) {
			switch (terminal.type()) {
				case TEXT, BINARY -> indentLines(terminal.value());
				default -> output.append(terminal.value());
			}
			return null;
		}

		@Override
		public Void visitTree(Tree tree) {
			List<BdnNode> children = tree.children();
			switch (tree.type()) {
				case COMPONENT -> all(children);
				case STRUCTURE -> {
					output.append('[');
					composite(tree.child(0));
					output.append(']');
					all(children.subList(1, children.size()));
				}
				case BLOCK -> {
					output.append('{');
					procedure((Tree) tree.child(0));
					output.append('}');
					all(children.subList(1, children.size()));
				}
				case PARAMETERS -> {
					output.append('(');
					composite(tree.child(0));
					output.append(')');
				}
				case RANGE, ARRAY, TABLE -> composite(tree);
				case ASSOCIATION -> {
					tree.child(0).accept(this);
					output.append(": ");
					tree.child(1).accept(this);
				}
				case TASK -> {
					tree.child(0).accept(this);
					procedure((Tree) tree.child(1));
				}
				case PROCEDURE -> procedure(tree);
				case STATEMENT -> separated(children, " ");
				case EVALUATE_CLAUSE -> {
					if (children.size() == 2) {
						tree.child(0).accept(this);
						output.append(" := ");
					}
					children.get(children.size() - 1).accept(this);
				}
				case CHECKOUT_CLAUSE -> keywords(children, "checkout ", " from ");
				case SAVE_CLAUSE -> keywords(children, "save ", " to ");
				case DISCARD_CLAUSE -> keywords(children, "discard ");
				case COMMIT_CLAUSE -> keywords(children, "commit ", " to ");
				case PUBLISH_CLAUSE -> keywords(children, "publish ");
				case QUEUE_CLAUSE -> keywords(children, "queue ", " on ");
				case WAIT_CLAUSE -> keywords(children, "wait for ", " from ");
				case THROW_CLAUSE -> keywords(children, "throw ");
				case HANDLE_CLAUSE -> keywords(children, "handle ", " matching ", " with ");
				case FINISH_CLAUSE -> keywords(children, "finish with ");
				case IF_CLAUSE -> ifClause(children);
				case SELECT_CLAUSE -> selectClause(children);
				case WHILE_CLAUSE -> whileClause(children);
				case WITH_CLAUSE -> withClause(children);
				case CONTINUE_CLAUSE -> jump("continue", " to ", children);
				case BREAK_CLAUSE -> jump("break", " from ", children);
				case RETURN_CLAUSE -> {
					output.append("return");
					if (!children.isEmpty()) {
						output.append(' ');
						tree.child(0).accept(this);
					}
				}
				case ARITHMETIC_EXPRESSION, COMPARISON_EXPRESSION, LOGICAL_EXPRESSION, DEFAULT_EXPRESSION,
						EXPONENTIAL_EXPRESSION -> {
					tree.child(0).accept(this);
					output.append(' ').append(tree.operator()).append(' ');
					tree.child(1).accept(this);
				}
				case FACTORIAL_EXPRESSION -> {
					tree.child(0).accept(this);
					output.append('!');
				}
				case SUBCOMPONENT_EXPRESSION, FUNCTION_EXPRESSION -> all(children);
				case MESSAGE_EXPRESSION -> {
					tree.child(0).accept(this);
					output.append('.');
					tree.child(1).accept(this);
					tree.child(2).accept(this);
				}
				case INDICES -> {
					output.append('[');
					composite(tree.child(0));
					output.append(']');
				}
				case PRECEDENCE_EXPRESSION -> {
					output.append('(');
					tree.child(0).accept(this);
					output.append(')');
				}
				case MAGNITUDE_EXPRESSION -> {
					output.append('|');
					tree.child(0).accept(this);
					output.append('|');
				}
				case DEREFERENCE_EXPRESSION -> {
					output.append('@');
					tree.child(0).accept(this);
				}
				case COMPLEMENT_EXPRESSION -> {
					output.append("not ");
					tree.child(0).accept(this);
				}
				case INVERSION_EXPRESSION -> inversion(tree);
				default -> throw new IllegalArgumentException("Not a tree node type: " + tree.type());
			}
			return null;
		}

		private void composite(BdnNode node) {
			Tree composite = (Tree) node;
			switch (composite.type()) {
				case RANGE -> {
					composite.child(0).accept(this);
					output.append("..");
					composite.child(1).accept(this);
				}
				case TABLE -> {
					if (composite.children().isEmpty()) {
						output.append(':');
					} else {
						items(composite, ", ");
					}
				}
				default -> items(composite, ", ");
			}
		}

		/**
		 * Writes the items inline, or one per line when the collection is too large.
		 */
		private void items(Tree collection, String separator) {
			depth++;
			if (collection.size() <= options.maxInlineSize()) {
				separated(collection.children(), separator);
			} else {
				lines(collection.children());
			}
			depth--;
			if (collection.size() > options.maxInlineSize() && !collection.children().isEmpty()) {
				indent();
			}
		}

		private void procedure(Tree procedure) {
			if (procedure.children().isEmpty()) {
				return;
			}
			depth++;
			lines(procedure.children());
			depth--;
			indent();
		}

		private void lines(List<BdnNode> items) {
			if (items.isEmpty()) {
				return;
			}
			output.append('\n');
			for (BdnNode item : items) {
				indent();
				item.accept(this);
				output.append('\n');
			}
		}

		private void ifClause(List<BdnNode> children) {
			output.append("if ");
			children.get(0).accept(this);
			output.append(" then ");
			children.get(1).accept(this);
			int index = 2;
			while (index + 1 < children.size()) {
				output.append(" else if ");
				children.get(index).accept(this);
				output.append(" then ");
				children.get(index + 1).accept(this);
				index += 2;
			}
			if (index < children.size()) {
				output.append(" else ");
				children.get(index).accept(this);
			}
		}

		private void selectClause(List<BdnNode> children) {
			output.append("select ");
			children.get(0).accept(this);
			output.append(" from");
			int index = 1;
			while (index + 1 < children.size()) {
				output.append(' ');
				children.get(index).accept(this);
				output.append(" do ");
				children.get(index + 1).accept(this);
				index += 2;
			}
			if (index < children.size()) {
				output.append(" else ");
				children.get(index).accept(this);
			}
		}

		private void whileClause(List<BdnNode> children) {
			List<BdnNode> rest = label(children);
			output.append("while ");
			rest.get(0).accept(this);
			output.append(" do ");
			rest.get(1).accept(this);
		}

		private void withClause(List<BdnNode> children) {
			List<BdnNode> rest = label(children);
			output.append("with ");
			if (rest.size() == 3) {
				output.append("each ");
				rest.get(0).accept(this);
				output.append(" in ");
				rest = rest.subList(1, rest.size());
			}
			rest.get(0).accept(this);
			output.append(" do ");
			rest.get(1).accept(this);
		}

		/**
		 * Writes a leading loop label and returns the remaining children.
		 */
		private List<BdnNode> label(List<BdnNode> children) {
			if (children.get(0).type() != NodeType.LABEL) {
				return children;
			}
			children.get(0).accept(this);
			output.append(": ");
			return children.subList(1, children.size());
		}

		private void jump(String keyword, String preposition, List<BdnNode> children) {
			output.append(keyword);
			if (!children.isEmpty()) {
				output.append(preposition);
				children.get(0).accept(this);
			}
		}

		/**
		 * Writes each child preceded by the matching keyword text.
		 */
		private void keywords(List<BdnNode> children, String... keywords) {
			for (int i = 0; i < children.size(); i++) {
				output.append(keywords[i]);
				children.get(i).accept(this);
			}
		}

		private void inversion(Tree tree) {
			String operator = tree.operator();
			output.append(operator);
			int start = output.length();
			tree.child(0).accept(this);
			char first = start < output.length() ? output.charAt(start) : ' ';
			// "-5" would lex as a negative number and "//" as integer division
			if ((operator.equals("-") && Character.isDigit(first)) || (operator.equals("/") && first == '/')) {
				output.insert(start, ' ');
			}
		}

		private void all(List<BdnNode> children) {
			for (BdnNode child : children) {
				child.accept(this);
			}
		}

		private void separated(List<BdnNode> children, String separator) {
			for (int i = 0; i < children.size(); i++) {
				if (i > 0) {
					output.append(separator);
				}
				children.get(i).accept(this);
			}
		}

		/**
		 * Re-inserts the current indentation after every line break that starts a non-empty line.
		 */
		private void indentLines(String value) {
			String padding = StringUtils.repeat(' ', depth * options.indentation());
			for (int i = 0; i < value.length(); i++) {
				char c = value.charAt(i);
				output.append(c);
				if (c == '\n' && i + 1 < value.length() && value.charAt(i + 1) != '\n') {
					output.append(padding);
				}
			}
		}

		private void indent() {
			output.append(StringUtils.repeat(' ', depth * options.indentation()));
		}
	}
}
