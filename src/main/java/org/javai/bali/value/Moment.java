package org.javai.bali.value;

/**
 * A moment in time at whatever precision was written, for example {@code <2024-03-01T12:30>}.
 * The ISO text is kept without the angle brackets.
 */
public record Moment(String iso) {

	public Moment {
		if (iso == null || iso.isEmpty()) {
			throw new IllegalArgumentException("Moment cannot be empty");
		}
	}

	public static Moment parse(String literal) {
		if (literal == null || !literal.startsWith("<") || !literal.endsWith(">")) {
			throw new IllegalArgumentException("Not a moment literal: " + literal);
		}
		return new Moment(literal.substring(1, literal.length() - 1));
	}

	@Override
	public String toString() {
		return "<" + iso + ">";
	}
}
