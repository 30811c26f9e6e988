package org.javai.bali.parse;

/**
 * A token of Bali Document Notation source.
 *
 * @param type the token kind
 * @param text the exact lexeme
 * @param line the 1-based line of the first character
 * @param column the 1-based column of the first character
 * @param offset the 0-based character offset in the source
 */
public record BdnToken(TokenType type, String text, int line, int column, int offset) implements ParseElement {

	public boolean isType(TokenType expectedType) {
		return type == expectedType;
	}

	@Override
	public String toString() {
		return switch (type) {
			case EOF -> "EOF";
			case NEWLINE -> "NEWLINE";
			default -> type.isLiteral() ? type.displayName() : type + "(" + text + ")";
		};
	}
}
