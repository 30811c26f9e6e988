package org.javai.bali.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.javai.bali.config.BdnOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser producing the concrete parse tree of Bali Document Notation.
 * <p>
 * Expressions are parsed by precedence climbing. Every public entry point requires the rest of the
 * token stream to be consumed (trailing newlines aside). The first mismatch aborts the parse with a
 * {@link BdnSyntaxException}; there is no recovery.
 * <p>
 * A parser holds the position within its token list, so an instance serves a single parse.
 *
 * <pre>
 * BdnGrammarParser parser = BdnGrammarParser.forSource("[1, 2, 3]", BdnOptions.defaults());
 * ParseNode document = parser.document();
 * </pre>
 */
public class BdnGrammarParser {

	private static final Logger logger = LoggerFactory.getLogger(BdnGrammarParser.class);

	// binding strength, higher binds tighter
	static final int DEFAULT = 10;
	static final int LOGICAL = 20;
	static final int COMPLEMENT_OPERAND = 30;
	static final int COMPARISON = 40;
	static final int ADDITIVE = 60;
	static final int MULTIPLICATIVE = 65;
	static final int INVERSION_OPERAND = 70;
	static final int EXPONENTIAL = 80;
	static final int FACTORIAL = 90;
	static final int SUBCOMPONENT = 100;
	static final int MESSAGE = 110;
	static final int DEREFERENCE_OPERAND = 120;

	private static final Set<TokenType> ELEMENT_START = EnumSet.of(
			TokenType.OPEN_PAREN, TokenType.MINUS, TokenType.IMAGINARY_UNIT, TokenType.UNDEFINED,
			TokenType.INFINITY, TokenType.TRUE, TokenType.FALSE, TokenType.NONE, TokenType.ANY,
			TokenType.TAG, TokenType.SYMBOL, TokenType.FRACTION, TokenType.CONSTANT, TokenType.FLOAT,
			TokenType.MOMENT, TokenType.DURATION, TokenType.RESOURCE, TokenType.VERSION, TokenType.BINARY,
			TokenType.TEXT_BLOCK, TokenType.TEXT);

	private static final Set<TokenType> COMPONENT_START = union(ELEMENT_START,
			EnumSet.of(TokenType.OPEN_BRACKET, TokenType.OPEN_BRACE));

	private static final Set<TokenType> EXPRESSION_START = union(COMPONENT_START,
			EnumSet.of(TokenType.IDENTIFIER, TokenType.AT, TokenType.SLASH, TokenType.STAR, TokenType.BAR,
					TokenType.NOT));

	private static final Set<TokenType> STATEMENT_START = union(EXPRESSION_START,
			EnumSet.of(TokenType.CHECKOUT, TokenType.SAVE, TokenType.DISCARD, TokenType.COMMIT,
					TokenType.PUBLISH, TokenType.QUEUE, TokenType.WAIT, TokenType.IF, TokenType.SELECT,
					TokenType.WHILE, TokenType.WITH, TokenType.CONTINUE, TokenType.BREAK, TokenType.RETURN,
					TokenType.THROW));

	private static final Set<TokenType> OPERATORS = EnumSet.of(
			TokenType.DOT, TokenType.OPEN_BRACKET, TokenType.BANG, TokenType.CARET, TokenType.STAR,
			TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PLUS, TokenType.MINUS, TokenType.LESS,
			TokenType.EQUAL, TokenType.MORE, TokenType.IS, TokenType.MATCHES, TokenType.AND, TokenType.SANS,
			TokenType.XOR, TokenType.OR, TokenType.QUESTION);

	private final ParserState state;
	private final String source;
	private final boolean debug;

	public BdnGrammarParser(List<BdnToken> tokens) {
		this(tokens, null, BdnOptions.defaults());
	}

	/**
	 * @param tokens the tokens to parse; an EOF token is appended when missing
	 * @param source the text the tokens came from, used only for debug excerpts (may be {@code null})
	 * @param options parser options
	 */
	public BdnGrammarParser(List<BdnToken> tokens, String source, BdnOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("Options cannot be null");
		}
		this.state = new ParserState(tokens);
		this.source = source;
		this.debug = options.debug();
	}

	/**
	 * Tokenizes the source and returns a parser positioned at its first token.
	 *
	 * @throws BdnLexicalException if the source cannot be tokenized
	 */
	public static BdnGrammarParser forSource(String source, BdnOptions options) {
		List<BdnToken> tokens = new BdnTokenizer(source, options).tokenize();
		return new BdnGrammarParser(tokens, source, options);
	}

	// entry points

	/**
	 * {@code document: NEWLINE* component NEWLINE* EOF}
	 */
	public ParseNode document() {
		List<ParseElement> children = new ArrayList<>();
		newlines(children);
		children.add(parseComponent());
		newlines(children);
		expect(TokenType.EOF);
		return ParseNode.of(GrammarRule.DOCUMENT, children);
	}

	/**
	 * {@code task: SHELL NEWLINE* procedure NEWLINE* EOF}
	 */
	public ParseNode task() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.SHELL));
		// the last newline opens the procedure
		while (state.check(TokenType.NEWLINE) && state.peek(1).type() == TokenType.NEWLINE) {
			children.add(state.advance());
		}
		children.add(procedure(TokenType.EOF));
		newlines(children);
		expect(TokenType.EOF);
		return ParseNode.of(GrammarRule.TASK, children);
	}

	public ParseNode component() {
		return complete(parseComponent());
	}

	public ParseNode element() {
		return complete(parseElement());
	}

	public ParseNode structure() {
		return complete(parseStructure());
	}

	public ParseNode block() {
		return complete(parseBlock());
	}

	public ParseNode parameters() {
		return complete(parseParameters());
	}

	public ParseNode range() {
		ParseNode first = expression(0);
		return complete(parseRange(first));
	}

	public ParseNode array() {
		return complete(parseArray(TokenType.EOF));
	}

	public ParseNode table() {
		return complete(parseTable(TokenType.EOF));
	}

	public ParseNode association() {
		return complete(parseAssociation(parseElement()));
	}

	public ParseNode procedure() {
		return complete(procedure(TokenType.EOF));
	}

	public ParseNode statement() {
		return complete(parseStatement());
	}

	public ParseNode expression() {
		return complete(expression(0));
	}

	private ParseNode complete(ParseNode node) {
		newlines(new ArrayList<>());
		expect(TokenType.EOF);
		return node;
	}

	// components

	private ParseNode parseComponent() {
		ParseNode inner;
		if (state.check(TokenType.OPEN_BRACKET)) {
			inner = parseStructure();
		} else if (state.check(TokenType.OPEN_BRACE)) {
			inner = parseBlock();
		} else if (isElementStart()) {
			inner = parseElement();
		} else {
			throw fail();
		}
		return ParseNode.of(GrammarRule.COMPONENT, List.of(inner));
	}

	private ParseNode parseStructure() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.OPEN_BRACKET));
		children.add(parseComposite(TokenType.CLOSE_BRACKET));
		children.add(expect(TokenType.CLOSE_BRACKET));
		optionalParameters(children);
		return ParseNode.of(GrammarRule.STRUCTURE, children);
	}

	private ParseNode parseBlock() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.OPEN_BRACE));
		children.add(procedure(TokenType.CLOSE_BRACE));
		children.add(expect(TokenType.CLOSE_BRACE));
		optionalParameters(children);
		return ParseNode.of(GrammarRule.BLOCK, children);
	}

	private ParseNode parseParameters() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.OPEN_PAREN));
		children.add(parseComposite(TokenType.CLOSE_PAREN));
		children.add(expect(TokenType.CLOSE_PAREN));
		return ParseNode.of(GrammarRule.PARAMETERS, children);
	}

	private void optionalParameters(List<ParseElement> children) {
		if (state.check(TokenType.OPEN_PAREN)) {
			children.add(parseParameters());
		}
	}

	// composites

	/**
	 * Chooses between range, array and table. An empty or newline-opened composite is decided by
	 * its first token; otherwise the first item is parsed as an expression and the token after it
	 * decides: {@code ..} makes a range, {@code :} after a bare element makes a table.
	 */
	private ParseNode parseComposite(TokenType close) {
		if (state.check(TokenType.COLON)) {
			resolved("empty table");
			return new ParseNode(GrammarRule.TABLE, Variant.EMPTY, List.of(state.advance()));
		}
		if (state.check(close)) {
			resolved("empty array");
			return new ParseNode(GrammarRule.ARRAY, Variant.EMPTY, List.of());
		}
		if (state.check(TokenType.NEWLINE)) {
			BdnToken newline = state.advance();
			if (state.check(close)) {
				resolved("empty newline array");
				return new ParseNode(GrammarRule.ARRAY, Variant.NEWLINE, List.of(newline));
			}
			ParseNode first = expression(0);
			if (state.check(TokenType.COLON) && isBareElement(first)) {
				resolved("newline table");
				return newlineTable(newline, associationKey(first));
			}
			resolved("newline array");
			return newlineArray(newline, first);
		}
		ParseNode first = expression(0);
		if (state.check(TokenType.DOT_DOT)) {
			resolved("range");
			return parseRange(first);
		}
		if (state.check(TokenType.COLON) && isBareElement(first)) {
			resolved("inline table");
			return inlineTable(associationKey(first));
		}
		resolved("inline array");
		return inlineArray(first);
	}

	private ParseNode parseRange(ParseNode first) {
		List<ParseElement> children = new ArrayList<>();
		children.add(first);
		children.add(expect(TokenType.DOT_DOT));
		children.add(expression(0));
		return ParseNode.of(GrammarRule.RANGE, children);
	}

	private ParseNode parseArray(TokenType close) {
		if (state.check(close)) {
			return new ParseNode(GrammarRule.ARRAY, Variant.EMPTY, List.of());
		}
		if (state.check(TokenType.NEWLINE)) {
			BdnToken newline = state.advance();
			if (state.check(close)) {
				return new ParseNode(GrammarRule.ARRAY, Variant.NEWLINE, List.of(newline));
			}
			return newlineArray(newline, expression(0));
		}
		return inlineArray(expression(0));
	}

	private ParseNode inlineArray(ParseNode first) {
		List<ParseElement> children = new ArrayList<>();
		children.add(first);
		while (state.check(TokenType.COMMA)) {
			children.add(state.advance());
			children.add(expression(0));
		}
		return new ParseNode(GrammarRule.ARRAY, Variant.INLINE, children);
	}

	private ParseNode newlineArray(BdnToken newline, ParseNode first) {
		List<ParseElement> children = new ArrayList<>();
		children.add(newline);
		children.add(first);
		children.add(expect(TokenType.NEWLINE));
		while (isExpressionStart()) {
			children.add(expression(0));
			children.add(expect(TokenType.NEWLINE));
		}
		return new ParseNode(GrammarRule.ARRAY, Variant.NEWLINE, children);
	}

	private ParseNode parseTable(TokenType close) {
		if (state.check(TokenType.COLON)) {
			return new ParseNode(GrammarRule.TABLE, Variant.EMPTY, List.of(state.advance()));
		}
		if (state.check(TokenType.NEWLINE)) {
			BdnToken newline = state.advance();
			return newlineTable(newline, parseElement());
		}
		return inlineTable(parseElement());
	}

	private ParseNode inlineTable(ParseNode firstKey) {
		List<ParseElement> children = new ArrayList<>();
		children.add(parseAssociation(firstKey));
		while (state.check(TokenType.COMMA)) {
			children.add(state.advance());
			children.add(parseAssociation(parseElement()));
		}
		return new ParseNode(GrammarRule.TABLE, Variant.INLINE, children);
	}

	private ParseNode newlineTable(BdnToken newline, ParseNode firstKey) {
		List<ParseElement> children = new ArrayList<>();
		children.add(newline);
		children.add(parseAssociation(firstKey));
		children.add(expect(TokenType.NEWLINE));
		while (isElementStart()) {
			children.add(parseAssociation(parseElement()));
			children.add(expect(TokenType.NEWLINE));
		}
		return new ParseNode(GrammarRule.TABLE, Variant.NEWLINE, children);
	}

	private ParseNode parseAssociation(ParseNode key) {
		List<ParseElement> children = new ArrayList<>();
		children.add(key);
		children.add(expect(TokenType.COLON));
		children.add(expression(0));
		return ParseNode.of(GrammarRule.ASSOCIATION, children);
	}

	private static boolean isBareElement(ParseNode expression) {
		return expression.rule() == GrammarRule.COMPONENT_EXPRESSION
				&& expression.node(0).node(0).rule() == GrammarRule.ELEMENT;
	}

	private static ParseNode associationKey(ParseNode componentExpression) {
		return componentExpression.node(0).node(0);
	}

	// elements

	private ParseNode parseElement() {
		List<ParseElement> children = new ArrayList<>();
		BdnToken token = state.peek();
		switch (token.type()) {
			case OPEN_PAREN -> {
				if (!isComplexAhead()) {
					throw fail(ELEMENT_START);
				}
				children.add(complexNumber());
			}
			case MINUS, IMAGINARY_UNIT, CONSTANT, FLOAT -> children.add(numeric());
			case UNDEFINED -> children.add(new ParseNode(GrammarRule.NUMBER, Variant.UNDEFINED,
					List.of(state.advance())));
			case INFINITY -> children.add(new ParseNode(GrammarRule.NUMBER, Variant.INFINITE,
					List.of(state.advance())));
			case TEXT -> children.add(new ParseNode(GrammarRule.TEXT, Variant.INLINE, List.of(state.advance())));
			case TEXT_BLOCK -> children.add(new ParseNode(GrammarRule.TEXT, Variant.NEWLINE,
					List.of(state.advance())));
			case BINARY -> {
				Variant variant = token.text().indexOf('\n') >= 0 ? Variant.NEWLINE : Variant.INLINE;
				children.add(new ParseNode(GrammarRule.BINARY, variant, List.of(state.advance())));
			}
			case TRUE, FALSE, FRACTION, NONE, ANY, TAG, SYMBOL, MOMENT, DURATION, RESOURCE, VERSION ->
					children.add(state.advance());
			default -> throw fail(ELEMENT_START);
		}
		optionalParameters(children);
		return ParseNode.of(GrammarRule.ELEMENT, children);
	}

	/**
	 * A real, imaginary or percent literal.
	 */
	private ParseNode numeric() {
		if (state.check(TokenType.MINUS) && state.peek(1).type() == TokenType.IMAGINARY_UNIT) {
			ParseNode imaginary = ParseNode.of(GrammarRule.IMAGINARY, List.of(state.advance(), state.advance()));
			return new ParseNode(GrammarRule.NUMBER, Variant.IMAGINARY, List.of(imaginary));
		}
		if (state.check(TokenType.IMAGINARY_UNIT)) {
			ParseNode imaginary = ParseNode.of(GrammarRule.IMAGINARY, List.of(state.advance()));
			return new ParseNode(GrammarRule.NUMBER, Variant.IMAGINARY, List.of(imaginary));
		}
		ParseNode real = real();
		if (state.check(TokenType.IMAGINARY_UNIT)) {
			ParseNode imaginary = ParseNode.of(GrammarRule.IMAGINARY, List.of(real, state.advance()));
			return new ParseNode(GrammarRule.NUMBER, Variant.IMAGINARY, List.of(imaginary));
		}
		if (state.check(TokenType.PERCENT)) {
			return ParseNode.of(GrammarRule.PERCENT, List.of(real, state.advance()));
		}
		return new ParseNode(GrammarRule.NUMBER, Variant.REAL, List.of(real));
	}

	/**
	 * {@code '(' real (',' | 'e^') imaginary ')'}
	 */
	private ParseNode complexNumber() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.OPEN_PAREN));
		children.add(real());
		Variant variant;
		if (state.check(TokenType.COMMA)) {
			variant = Variant.RECTANGULAR;
		} else if (state.check(TokenType.POLAR)) {
			variant = Variant.POLAR;
		} else {
			throw fail();
		}
		children.add(state.advance());
		children.add(imaginary());
		children.add(expect(TokenType.CLOSE_PAREN));
		return new ParseNode(GrammarRule.NUMBER, variant, children);
	}

	private ParseNode imaginary() {
		List<ParseElement> children = new ArrayList<>();
		if (state.check(TokenType.MINUS) && state.peek(1).type() == TokenType.IMAGINARY_UNIT) {
			children.add(state.advance());
		} else if (!state.check(TokenType.IMAGINARY_UNIT)) {
			children.add(real());
		}
		children.add(expect(TokenType.IMAGINARY_UNIT));
		return ParseNode.of(GrammarRule.IMAGINARY, children);
	}

	/**
	 * {@code '-'? CONSTANT | FLOAT}
	 */
	private ParseNode real() {
		if (state.check(TokenType.FLOAT)) {
			return ParseNode.of(GrammarRule.REAL, List.of(state.advance()));
		}
		List<ParseElement> children = new ArrayList<>();
		if (state.check(TokenType.MINUS)) {
			children.add(state.advance());
		}
		children.add(expect(TokenType.CONSTANT));
		return ParseNode.of(GrammarRule.REAL, children);
	}

	private boolean isComplexAhead() {
		if (state.peek().type() != TokenType.OPEN_PAREN) {
			return false;
		}
		int ahead = 1;
		TokenType type = state.peek(ahead).type();
		if (type == TokenType.MINUS) {
			ahead++;
			if (state.peek(ahead).type() != TokenType.CONSTANT) {
				return false;
			}
		} else if (type != TokenType.FLOAT && type != TokenType.CONSTANT) {
			return false;
		}
		TokenType delimiter = state.peek(ahead + 1).type();
		return delimiter == TokenType.COMMA || delimiter == TokenType.POLAR;
	}

	// procedures

	/**
	 * Parses an inline, newline or empty procedure. The empty form is chosen when the next token
	 * cannot begin a statement; {@code close} only names the token expected after it.
	 */
	private ParseNode procedure(TokenType close) {
		if (state.check(TokenType.NEWLINE)) {
			List<ParseElement> children = new ArrayList<>();
			children.add(state.advance());
			while (isStatementStart()) {
				children.add(parseStatement());
				children.add(expect(TokenType.NEWLINE));
			}
			return new ParseNode(GrammarRule.PROCEDURE, Variant.NEWLINE, children);
		}
		if (isStatementStart()) {
			List<ParseElement> children = new ArrayList<>();
			children.add(parseStatement());
			while (state.check(TokenType.SEMICOLON)) {
				children.add(state.advance());
				children.add(parseStatement());
			}
			return new ParseNode(GrammarRule.PROCEDURE, Variant.INLINE, children);
		}
		state.expectLater(close);
		return new ParseNode(GrammarRule.PROCEDURE, Variant.EMPTY, List.of());
	}

	private ParseNode parseStatement() {
		List<ParseElement> children = new ArrayList<>();
		children.add(mainClause());
		while (state.check(TokenType.HANDLE)) {
			children.add(handleClause());
		}
		if (state.check(TokenType.FINISH)) {
			children.add(finishClause());
		}
		return ParseNode.of(GrammarRule.STATEMENT, children);
	}

	private ParseNode mainClause() {
		return switch (state.peek().type()) {
			case CHECKOUT -> clause(GrammarRule.CHECKOUT_CLAUSE,
					TokenType.CHECKOUT, TokenType.SYMBOL, TokenType.FROM, null);
			case SAVE -> clause(GrammarRule.SAVE_CLAUSE, TokenType.SAVE, null, TokenType.TO, null);
			case DISCARD -> clause(GrammarRule.DISCARD_CLAUSE, TokenType.DISCARD, null);
			case COMMIT -> clause(GrammarRule.COMMIT_CLAUSE, TokenType.COMMIT, null, TokenType.TO, null);
			case PUBLISH -> clause(GrammarRule.PUBLISH_CLAUSE, TokenType.PUBLISH, null);
			case QUEUE -> clause(GrammarRule.QUEUE_CLAUSE, TokenType.QUEUE, null, TokenType.ON, null);
			case WAIT -> clause(GrammarRule.WAIT_CLAUSE,
					TokenType.WAIT, TokenType.FOR, TokenType.SYMBOL, TokenType.FROM, null);
			case THROW -> clause(GrammarRule.THROW_CLAUSE, TokenType.THROW, null);
			case IF -> ifClause();
			case SELECT -> selectClause();
			case WHILE -> whileClause(new ArrayList<>());
			case WITH -> withClause(new ArrayList<>());
			case CONTINUE -> labelJump(GrammarRule.CONTINUE_CLAUSE, TokenType.CONTINUE, TokenType.TO);
			case BREAK -> labelJump(GrammarRule.BREAK_CLAUSE, TokenType.BREAK, TokenType.FROM);
			case RETURN -> returnClause();
			case IDENTIFIER -> isLabelAhead() ? labelledLoop() : evaluateClause();
			default -> {
				if (!isExpressionStart()) {
					throw fail(STATEMENT_START);
				}
				yield evaluateClause();
			}
		};
	}

	/**
	 * Matches a fixed sequence where {@code null} stands for an expression.
	 */
	private ParseNode clause(GrammarRule rule, TokenType... sequence) {
		List<ParseElement> children = new ArrayList<>();
		for (TokenType type : sequence) {
			children.add(type == null ? expression(0) : expect(type));
		}
		return ParseNode.of(rule, children);
	}

	/**
	 * {@code ((symbol | variable indices) ':=')? expression}
	 */
	private ParseNode evaluateClause() {
		ParseNode expression = expression(0);
		if (!state.check(TokenType.ASSIGN)) {
			return ParseNode.of(GrammarRule.EVALUATE_CLAUSE, List.of(expression));
		}
		ParseNode recipient = recipient(expression);
		if (recipient == null) {
			state.forget(TokenType.ASSIGN);
			throw fail();
		}
		List<ParseElement> children = new ArrayList<>();
		children.add(recipient);
		children.add(state.advance());
		children.add(expression(0));
		return ParseNode.of(GrammarRule.EVALUATE_CLAUSE, children);
	}

	private static ParseNode recipient(ParseNode expression) {
		if (expression.rule() == GrammarRule.COMPONENT_EXPRESSION) {
			ParseNode inner = expression.node(0).node(0);
			if (inner.rule() == GrammarRule.ELEMENT && inner.children().size() == 1
					&& inner.hasToken(TokenType.SYMBOL)) {
				return ParseNode.of(GrammarRule.RECIPIENT, List.of(inner.token(TokenType.SYMBOL)));
			}
			return null;
		}
		if (expression.rule() == GrammarRule.SUBCOMPONENT_EXPRESSION
				&& expression.node(0).rule() == GrammarRule.VARIABLE_EXPRESSION) {
			BdnToken variable = expression.node(0).token(TokenType.IDENTIFIER);
			return ParseNode.of(GrammarRule.RECIPIENT, List.of(variable, expression.node(1)));
		}
		return null;
	}

	private ParseNode ifClause() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.IF));
		children.add(expression(0));
		children.add(expect(TokenType.THEN));
		children.add(parseBlock());
		while (state.check(TokenType.ELSE)) {
			children.add(state.advance());
			if (state.check(TokenType.IF)) {
				children.add(state.advance());
				children.add(expression(0));
				children.add(expect(TokenType.THEN));
				children.add(parseBlock());
			} else {
				children.add(parseBlock());
				break;
			}
		}
		return ParseNode.of(GrammarRule.IF_CLAUSE, children);
	}

	private ParseNode selectClause() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.SELECT));
		children.add(expression(0));
		children.add(expect(TokenType.FROM));
		do {
			children.add(expression(0));
			children.add(expect(TokenType.DO));
			children.add(parseBlock());
		} while (isExpressionStart());
		if (state.check(TokenType.ELSE)) {
			children.add(state.advance());
			children.add(parseBlock());
		}
		return ParseNode.of(GrammarRule.SELECT_CLAUSE, children);
	}

	private boolean isLabelAhead() {
		if (state.peek(1).type() != TokenType.COLON) {
			return false;
		}
		TokenType loop = state.peek(2).type();
		return loop == TokenType.WHILE || loop == TokenType.WITH;
	}

	private ParseNode labelledLoop() {
		List<ParseElement> children = new ArrayList<>();
		children.add(state.advance());
		children.add(state.advance());
		resolved("labelled loop");
		return state.peek().type() == TokenType.WHILE ? whileClause(children) : withClause(children);
	}

	private ParseNode whileClause(List<ParseElement> children) {
		children.add(expect(TokenType.WHILE));
		children.add(expression(0));
		children.add(expect(TokenType.DO));
		children.add(parseBlock());
		return ParseNode.of(GrammarRule.WHILE_CLAUSE, children);
	}

	private ParseNode withClause(List<ParseElement> children) {
		children.add(expect(TokenType.WITH));
		if (state.check(TokenType.EACH)) {
			children.add(state.advance());
			children.add(expect(TokenType.SYMBOL));
			children.add(expect(TokenType.IN));
		}
		children.add(expression(0));
		children.add(expect(TokenType.DO));
		children.add(parseBlock());
		return ParseNode.of(GrammarRule.WITH_CLAUSE, children);
	}

	private ParseNode labelJump(GrammarRule rule, TokenType keyword, TokenType preposition) {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(keyword));
		if (state.check(preposition)) {
			children.add(state.advance());
			children.add(expect(TokenType.IDENTIFIER));
		}
		return ParseNode.of(rule, children);
	}

	private ParseNode returnClause() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.RETURN));
		if (isExpressionStart()) {
			children.add(expression(0));
		}
		return ParseNode.of(GrammarRule.RETURN_CLAUSE, children);
	}

	private ParseNode handleClause() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.HANDLE));
		children.add(expect(TokenType.SYMBOL));
		children.add(expect(TokenType.MATCHING));
		children.add(expression(0));
		children.add(expect(TokenType.WITH));
		children.add(parseBlock());
		return ParseNode.of(GrammarRule.HANDLE_CLAUSE, children);
	}

	private ParseNode finishClause() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.FINISH));
		children.add(expect(TokenType.WITH));
		children.add(parseBlock());
		return ParseNode.of(GrammarRule.FINISH_CLAUSE, children);
	}

	// expressions

	/**
	 * Parses an expression whose binary and postfix operators all bind at least as tightly as
	 * {@code minPrecedence}.
	 */
	private ParseNode expression(int minPrecedence) {
		ParseNode left = primary();
		while (true) {
			state.expectLater(OPERATORS);
			BdnToken token = state.peek();
			switch (token.type()) {
				case DOT -> {
					if (MESSAGE < minPrecedence) {
						return left;
					}
					BdnToken dot = state.advance();
					left = ParseNode.of(GrammarRule.MESSAGE_EXPRESSION, List.of(left, dot, invocation()));
				}
				case OPEN_BRACKET -> {
					if (SUBCOMPONENT < minPrecedence) {
						return left;
					}
					left = ParseNode.of(GrammarRule.SUBCOMPONENT_EXPRESSION, List.of(left, indices()));
				}
				case BANG -> {
					if (FACTORIAL < minPrecedence) {
						return left;
					}
					left = ParseNode.of(GrammarRule.FACTORIAL_EXPRESSION, List.of(left, state.advance()));
				}
				case CARET -> {
					if (EXPONENTIAL < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.EXPONENTIAL_EXPRESSION, left, EXPONENTIAL);
				}
				case STAR, SLASH, DOUBLE_SLASH -> {
					if (MULTIPLICATIVE < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.ARITHMETIC_EXPRESSION, left, MULTIPLICATIVE + 1);
				}
				case PLUS, MINUS -> {
					if (ADDITIVE < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.ARITHMETIC_EXPRESSION, left, ADDITIVE + 1);
				}
				case LESS, EQUAL, MORE, IS, MATCHES -> {
					if (COMPARISON < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.COMPARISON_EXPRESSION, left, COMPARISON + 1);
				}
				case AND, SANS, XOR, OR -> {
					if (LOGICAL < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.LOGICAL_EXPRESSION, left, LOGICAL + 1);
				}
				case QUESTION -> {
					if (DEFAULT < minPrecedence) {
						return left;
					}
					left = binary(GrammarRule.DEFAULT_EXPRESSION, left, DEFAULT);
				}
				default -> {
					return left;
				}
			}
		}
	}

	private ParseNode binary(GrammarRule rule, ParseNode left, int rightPrecedence) {
		BdnToken operator = state.advance();
		ParseNode right = expression(rightPrecedence);
		return ParseNode.of(rule, List.of(left, operator, right));
	}

	private ParseNode primary() {
		BdnToken token = state.peek();
		switch (token.type()) {
			case IDENTIFIER -> {
				if (state.peek(1).type() == TokenType.OPEN_PAREN) {
					return ParseNode.of(GrammarRule.FUNCTION_EXPRESSION, List.of(invocation()));
				}
				return ParseNode.of(GrammarRule.VARIABLE_EXPRESSION, List.of(state.advance()));
			}
			case OPEN_PAREN -> {
				if (isComplexAhead()) {
					return componentExpression();
				}
				BdnToken open = state.advance();
				ParseNode inner = expression(0);
				return ParseNode.of(GrammarRule.PRECEDENCE_EXPRESSION, List.of(open, inner, expect(TokenType.CLOSE_PAREN)));
			}
			case AT -> {
				BdnToken at = state.advance();
				return ParseNode.of(GrammarRule.DEREFERENCE_EXPRESSION, List.of(at, expression(DEREFERENCE_OPERAND)));
			}
			case MINUS -> {
				TokenType next = state.peek(1).type();
				if (next == TokenType.CONSTANT || next == TokenType.IMAGINARY_UNIT) {
					resolved("signed constant");
					return componentExpression();
				}
				return inversion();
			}
			case SLASH, STAR -> {
				return inversion();
			}
			case BAR -> {
				BdnToken open = state.advance();
				ParseNode inner = expression(0);
				return ParseNode.of(GrammarRule.MAGNITUDE_EXPRESSION, List.of(open, inner, expect(TokenType.BAR)));
			}
			case NOT -> {
				BdnToken not = state.advance();
				return ParseNode.of(GrammarRule.COMPLEMENT_EXPRESSION, List.of(not, expression(COMPLEMENT_OPERAND)));
			}
			default -> {
				if (!isComponentStart()) {
					throw fail(EXPRESSION_START);
				}
				return componentExpression();
			}
		}
	}

	private ParseNode componentExpression() {
		return ParseNode.of(GrammarRule.COMPONENT_EXPRESSION, List.of(parseComponent()));
	}

	private ParseNode inversion() {
		BdnToken operator = state.advance();
		return ParseNode.of(GrammarRule.INVERSION_EXPRESSION, List.of(operator, expression(INVERSION_OPERAND)));
	}

	/**
	 * {@code name parameters}
	 */
	private ParseNode invocation() {
		BdnToken name = expect(TokenType.IDENTIFIER);
		return ParseNode.of(GrammarRule.INVOCATION, List.of(name, parseParameters()));
	}

	/**
	 * {@code '[' array ']'}
	 */
	private ParseNode indices() {
		List<ParseElement> children = new ArrayList<>();
		children.add(expect(TokenType.OPEN_BRACKET));
		children.add(parseArray(TokenType.CLOSE_BRACKET));
		children.add(expect(TokenType.CLOSE_BRACKET));
		return ParseNode.of(GrammarRule.INDICES, children);
	}

	// lookahead helpers

	private boolean isElementStart() {
		state.expectLater(ELEMENT_START);
		TokenType type = state.peek().type();
		if (type == TokenType.OPEN_PAREN) {
			return isComplexAhead();
		}
		if (type == TokenType.MINUS) {
			TokenType next = state.peek(1).type();
			return next == TokenType.CONSTANT || next == TokenType.IMAGINARY_UNIT;
		}
		return ELEMENT_START.contains(type);
	}

	private boolean isComponentStart() {
		TokenType type = state.peek().type();
		if (type == TokenType.OPEN_BRACKET || type == TokenType.OPEN_BRACE) {
			return true;
		}
		state.expectLater(COMPONENT_START);
		return isElementStart();
	}

	private boolean isExpressionStart() {
		state.expectLater(EXPRESSION_START);
		return EXPRESSION_START.contains(state.peek().type());
	}

	private boolean isStatementStart() {
		state.expectLater(STATEMENT_START);
		return STATEMENT_START.contains(state.peek().type());
	}

	private void newlines(List<ParseElement> children) {
		while (state.check(TokenType.NEWLINE)) {
			children.add(state.advance());
		}
	}

	private BdnToken expect(TokenType type) {
		if (state.check(type)) {
			return state.advance();
		}
		throw fail();
	}

	private void resolved(String alternative) {
		if (debug) {
			BdnToken token = state.peek();
			logger.debug("PARSER: Resolved {} at line {}, column {}", alternative, token.line(), token.column());
		}
	}

	private BdnSyntaxException fail() {
		return fail(Set.of());
	}

	private BdnSyntaxException fail(Collection<TokenType> alsoExpected) {
		state.expectLater(alsoExpected);
		BdnToken token = state.peek();
		BdnSyntaxException error = new BdnSyntaxException(token, state.expected());
		if (debug) {
			if (source != null) {
				logger.debug("{}\n{}", error.getMessage(),
						SourceExcerpt.render(source, token.line(), token.column(), token.text().length()));
			} else {
				logger.debug(error.getMessage());
			}
		}
		return error;
	}

	private static Set<TokenType> union(Set<TokenType> first, Set<TokenType> second) {
		EnumSet<TokenType> union = EnumSet.copyOf(first);
		union.addAll(second);
		return union;
	}

	/**
	 * Position within the token list, plus the token kinds tried since the last token was consumed.
	 * The tried kinds become the expected set of a {@link BdnSyntaxException}.
	 */
	static final class ParserState {
		private final List<BdnToken> tokens;
		private final EnumSet<TokenType> expected = EnumSet.noneOf(TokenType.class);
		private int current = 0;

		ParserState(List<BdnToken> tokens) {
			List<BdnToken> copy = new ArrayList<>(tokens != null ? tokens : List.of());
			if (copy.isEmpty()) {
				copy.add(new BdnToken(TokenType.EOF, "", 1, 1, 0));
			} else if (copy.get(copy.size() - 1).type() != TokenType.EOF) {
				BdnToken last = copy.get(copy.size() - 1);
				copy.add(new BdnToken(TokenType.EOF, "", last.line(), last.column() + last.text().length(),
						last.offset() + last.text().length()));
			}
			this.tokens = List.copyOf(copy);
		}

		BdnToken peek() {
			return tokens.get(current);
		}

		BdnToken peek(int ahead) {
			return tokens.get(Math.min(current + ahead, tokens.size() - 1));
		}

		boolean check(TokenType type) {
			expected.add(type);
			return peek().type() == type;
		}

		BdnToken advance() {
			BdnToken token = peek();
			if (token.type() != TokenType.EOF) {
				current++;
			}
			expected.clear();
			return token;
		}

		void expectLater(TokenType type) {
			expected.add(type);
		}

		void expectLater(Collection<TokenType> types) {
			expected.addAll(types);
		}

		void forget(TokenType type) {
			expected.remove(type);
		}

		Set<TokenType> expected() {
			return EnumSet.copyOf(expected);
		}
	}
}
