package org.javai.bali.value;

/**
 * The pattern-matching placeholders {@code none} and {@code any}.
 */
public enum Template {
	NONE,
	ANY;

	public static Template parse(String literal) {
		return switch (literal) {
			case "none" -> NONE;
			case "any" -> ANY;
			default -> throw new IllegalArgumentException("Not a template literal: " + literal);
		};
	}

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
