package org.javai.bali.value;

/**
 * A base-32 tag literal such as {@code #VHF9Z3}. The value excludes the leading {@code #}.
 */
public record Tag(String value) {

	public Tag {
		if (value == null) {
			throw new IllegalArgumentException("Tag value cannot be null");
		}
	}

	public static Tag parse(String literal) {
		if (literal == null || !literal.startsWith("#")) {
			throw new IllegalArgumentException("Not a tag literal: " + literal);
		}
		return new Tag(literal.substring(1));
	}

	@Override
	public String toString() {
		return "#" + value;
	}
}
