package org.javai.bali.parse;

/**
 * Token kinds produced by {@link BdnTokenizer}.
 * <p>
 * The literal kinds come first and are matched by their exact text. When two kinds match
 * the same (longest) lexeme the one declared earlier wins, so keywords beat
 * {@link #IDENTIFIER} and {@link #VERSION} beats {@link #IDENTIFIER}.
 */
public enum TokenType {
	OPEN_BRACKET("["),
	CLOSE_BRACKET("]"),
	OPEN_PAREN("("),
	CLOSE_PAREN(")"),
	DOT_DOT(".."),
	COMMA(","),
	COLON(":"),
	OPEN_BRACE("{"),
	CLOSE_BRACE("}"),
	SEMICOLON(";"),
	HANDLE("handle"),
	MATCHING("matching"),
	WITH("with"),
	FINISH("finish"),
	ASSIGN(":="),
	CHECKOUT("checkout"),
	FROM("from"),
	SAVE("save"),
	TO("to"),
	DISCARD("discard"),
	COMMIT("commit"),
	PUBLISH("publish"),
	QUEUE("queue"),
	ON("on"),
	WAIT("wait"),
	FOR("for"),
	IF("if"),
	THEN("then"),
	ELSE("else"),
	SELECT("select"),
	DO("do"),
	WHILE("while"),
	EACH("each"),
	IN("in"),
	CONTINUE("continue"),
	BREAK("break"),
	RETURN("return"),
	THROW("throw"),
	AT("@"),
	DOT("."),
	BANG("!"),
	CARET("^"),
	MINUS("-"),
	SLASH("/"),
	STAR("*"),
	DOUBLE_SLASH("//"),
	PLUS("+"),
	BAR("|"),
	LESS("<"),
	EQUAL("="),
	MORE(">"),
	IS("is"),
	MATCHES("matches"),
	NOT("not"),
	AND("and"),
	SANS("sans"),
	XOR("xor"),
	OR("or"),
	QUESTION("?"),
	IMAGINARY_UNIT("i"),
	UNDEFINED("undefined"),
	INFINITY("infinity"),
	POLAR("e^"),
	PERCENT("%"),
	TRUE("true"),
	FALSE("false"),
	NONE("none"),
	ANY("any"),

	SHELL,
	TAG,
	SYMBOL,
	FRACTION,
	CONSTANT,
	FLOAT,
	MOMENT,
	DURATION,
	RESOURCE,
	VERSION,
	BINARY,
	TEXT_BLOCK,
	TEXT,
	IDENTIFIER,
	NEWLINE,
	SPACE,
	EOF;

	private final String literal;

	TokenType() {
		this(null);
	}

	TokenType(String literal) {
		this.literal = literal;
	}

	/**
	 * Returns the exact text of a literal token kind, or {@code null} for pattern-based kinds.
	 */
	public String literal() {
		return literal;
	}

	public boolean isLiteral() {
		return literal != null;
	}

	/**
	 * Name used in diagnostics: the quoted literal for keywords and punctuation, the kind name otherwise.
	 */
	public String displayName() {
		return literal != null ? "'" + literal + "'" : name();
	}
}
