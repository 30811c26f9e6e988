package org.javai.bali.value;

import java.util.Arrays;
import java.util.Base64;

/**
 * Bytes written as base-64 between single quotes. Line breaks and spaces inside the literal are
 * ignored.
 */
public final class Binary {

	private final byte[] bytes;

	public Binary(byte[] bytes) {
		if (bytes == null) {
			throw new IllegalArgumentException("Bytes cannot be null");
		}
		this.bytes = bytes.clone();
	}

	public static Binary parse(String literal) {
		if (literal == null || literal.length() < 2 || !literal.startsWith("'") || !literal.endsWith("'")) {
			throw new IllegalArgumentException("Not a binary literal: " + literal);
		}
		String encoded = literal.substring(1, literal.length() - 1).replaceAll("[\\s]", "");
		try {
			return new Binary(Base64.getDecoder().decode(encoded));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid base-64 in binary literal: " + literal, e);
		}
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	public int length() {
		return bytes.length;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Binary other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "'" + Base64.getEncoder().encodeToString(bytes) + "'";
	}
}
