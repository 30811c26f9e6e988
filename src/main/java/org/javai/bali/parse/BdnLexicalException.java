package org.javai.bali.parse;

import org.javai.bali.BdnException;

/**
 * Thrown when a character of the source does not begin any token.
 */
public class BdnLexicalException extends BdnException {

	private final int line;
	private final int column;
	private final char character;

	public BdnLexicalException(int line, int column, char character) {
		super("LEXER: An unexpected character was encountered: " + quote(character)
				+ " (line " + line + ", column " + column + ")");
		this.line = line;
		this.column = column;
		this.character = character;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}

	public char character() {
		return character;
	}

	private static String quote(char c) {
		return switch (c) {
			case '\r' -> "'\\r'";
			case '\t' -> "'\\t'";
			case '\f' -> "'\\f'";
			default -> Character.isISOControl(c) ? String.format("'\\u%04x'", (int) c) : "'" + c + "'";
		};
	}
}
