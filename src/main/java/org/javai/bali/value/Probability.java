package org.javai.bali.value;

import java.math.BigDecimal;

/**
 * A probability between 0 and 1 inclusive; {@code false} is 0 and {@code true} is 1.
 */
public record Probability(double value) {

	public static final Probability FALSE = new Probability(0);
	public static final Probability TRUE = new Probability(1);

	public Probability {
		if (Double.isNaN(value) || value < 0 || value > 1) {
			throw new IllegalArgumentException("Probability must be between 0 and 1: " + value);
		}
	}

	/**
	 * @param literal {@code true}, {@code false} or a fraction such as {@code .25}
	 */
	public static Probability parse(String literal) {
		return switch (literal) {
			case "true" -> TRUE;
			case "false" -> FALSE;
			default -> {
				if (!literal.startsWith(".")) {
					throw new IllegalArgumentException("Not a probability literal: " + literal);
				}
				yield new Probability(Double.parseDouble("0" + literal));
			}
		};
	}

	public boolean toBoolean() {
		return value >= 0.5;
	}

	@Override
	public String toString() {
		if (value == 0) {
			return "false";
		}
		if (value == 1) {
			return "true";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString().substring(1);
	}
}
