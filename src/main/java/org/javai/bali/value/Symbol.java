package org.javai.bali.value;

/**
 * A symbol literal such as {@code $customer}. The name excludes the leading {@code $}.
 */
public record Symbol(String name) {

	public Symbol {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("Symbol name cannot be empty");
		}
		if (!Character.isLetter(name.charAt(0))) {
			throw new IllegalArgumentException("Symbol name must start with a letter: " + name);
		}
	}

	/**
	 * @param literal symbol text including the leading {@code $}
	 */
	public static Symbol parse(String literal) {
		if (literal == null || !literal.startsWith("$")) {
			throw new IllegalArgumentException("Not a symbol literal: " + literal);
		}
		return new Symbol(literal.substring(1));
	}

	@Override
	public String toString() {
		return "$" + name;
	}
}
