package org.javai.bali.parse;

/**
 * Surface form chosen for a rule that has several alternative productions.
 */
public enum Variant {
	/** The rule has a single production. */
	DEFAULT,
	/** Items separated by commas or semicolons on one line; a single-line text or binary. */
	INLINE,
	/** Each item terminated by a newline; a multi-line text or binary. */
	NEWLINE,
	/** No items. */
	EMPTY,

	REAL,
	IMAGINARY,
	RECTANGULAR,
	POLAR,
	UNDEFINED,
	INFINITE
}
