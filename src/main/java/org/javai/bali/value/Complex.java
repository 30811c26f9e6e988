package org.javai.bali.value;

/**
 * A complex number in rectangular form.
 */
public record Complex(double real, double imaginary) {

	/**
	 * @param magnitude distance from the origin
	 * @param angle angle in radians
	 */
	public static Complex polar(double magnitude, double angle) {
		return new Complex(magnitude * Math.cos(angle), magnitude * Math.sin(angle));
	}

	public static Complex imaginary(double imaginary) {
		return new Complex(0, imaginary);
	}

	public double magnitude() {
		return Math.hypot(real, imaginary);
	}

	public double angle() {
		return Math.atan2(imaginary, real);
	}
}
