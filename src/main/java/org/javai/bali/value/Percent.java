package org.javai.bali.value;

/**
 * A percentage such as {@code 12.5%}.
 */
public record Percent(double value) {

	public double toFraction() {
		return value / 100;
	}

	@Override
	public String toString() {
		return (value == Math.rint(value) && !Double.isInfinite(value) ? Long.toString((long) value)
				: Double.toString(value)) + "%";
	}
}
