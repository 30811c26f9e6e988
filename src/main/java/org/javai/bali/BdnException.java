package org.javai.bali;

/**
 * Base exception for every failure raised while reading or converting Bali Document Notation.
 */
public class BdnException extends RuntimeException {

	public BdnException(String message) {
		super(message);
	}

	public BdnException(String message, Throwable cause) {
		super(message, cause);
	}
}
