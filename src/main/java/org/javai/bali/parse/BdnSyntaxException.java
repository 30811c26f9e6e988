package org.javai.bali.parse;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.bali.BdnException;

/**
 * Thrown when the token stream does not match the grammar. Parsing stops at the first such token.
 */
public class BdnSyntaxException extends BdnException {

	private final BdnToken token;
	private final Set<TokenType> expected;

	public BdnSyntaxException(BdnToken token, Collection<TokenType> expected) {
		super(describe(token, expected));
		this.token = token;
		EnumSet<TokenType> kinds = EnumSet.noneOf(TokenType.class);
		kinds.addAll(expected);
		this.expected = Collections.unmodifiableSet(kinds);
	}

	/**
	 * The token at which parsing failed.
	 */
	public BdnToken token() {
		return token;
	}

	/**
	 * The token kinds that would have been accepted instead of {@link #token()}.
	 */
	public Set<TokenType> expected() {
		return expected;
	}

	public int line() {
		return token.line();
	}

	public int column() {
		return token.column();
	}

	private static String describe(BdnToken token, Collection<TokenType> expected) {
		String text = switch (token.type()) {
			case EOF -> "<EOF>";
			case NEWLINE -> "\\n";
			default -> token.text();
		};
		String kinds = expected.stream()
				.sorted()
				.distinct()
				.map(TokenType::displayName)
				.collect(Collectors.joining(", "));
		return "PARSER: A mismatched token was encountered: \"" + text + "\" (line " + token.line()
				+ ", column " + token.column() + "), expected: " + kinds;
	}
}
