package org.javai.bali.value;

/**
 * A span of time such as {@code ~P3DT4H}. Calendar units are allowed, so the ISO text is kept
 * without the leading {@code ~} rather than converted to {@link java.time.Duration}.
 */
public record Duration(String iso) {

	public Duration {
		if (iso == null || !iso.startsWith("P")) {
			throw new IllegalArgumentException("Not an ISO duration: " + iso);
		}
	}

	public static Duration parse(String literal) {
		if (literal == null || !literal.startsWith("~")) {
			throw new IllegalArgumentException("Not a duration literal: " + literal);
		}
		return new Duration(literal.substring(1));
	}

	@Override
	public String toString() {
		return "~" + iso;
	}
}
