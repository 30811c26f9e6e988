package org.javai.bali.parse;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.bali.config.BdnOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer for Bali Document Notation.
 * <p>
 * At each offset every token kind is tried and the longest match wins; ties go to the kind
 * declared first in {@link TokenType}. {@link TokenType#SPACE} is matched but not emitted.
 * The first character that begins no token aborts the whole scan.
 */
public class BdnTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(BdnTokenizer.class);

	private static final String TIMESPAN = "(?:0|[1-9][0-9]*)(?:\\.[0-9]*[1-9])?";

	private static final Map<TokenType, Pattern> PATTERNS = patterns();

	private final String input;
	private final boolean debug;
	private int pos = 0;
	private int line = 1;
	private int lineStart = 0;

	public BdnTokenizer(String input) {
		this(input, BdnOptions.defaults());
	}

	public BdnTokenizer(String input, BdnOptions options) {
		this.input = input != null ? input : "";
		this.debug = options != null && options.debug();
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return the tokens, ending with an {@link TokenType#EOF} token
	 * @throws BdnLexicalException if a character does not begin any token
	 */
	public List<BdnToken> tokenize() {
		List<BdnToken> tokens = new ArrayList<>();
		while (!isAtEnd()) {
			BdnToken token = nextToken();
			if (token.type() != TokenType.SPACE) {
				tokens.add(token);
			}
			consume(token.text());
		}
		tokens.add(new BdnToken(TokenType.EOF, "", line, column(), pos));
		return Collections.unmodifiableList(tokens);
	}

	private BdnToken nextToken() {
		TokenType best = null;
		int bestEnd = pos;
		for (TokenType type : TokenType.values()) {
			int end = matchEnd(type);
			if (end > bestEnd) {
				best = type;
				bestEnd = end;
			}
		}
		if (best == null) {
			BdnLexicalException error = new BdnLexicalException(line, column(), input.charAt(pos));
			if (debug) {
				logger.debug("{}\n{}", error.getMessage(), SourceExcerpt.render(input, line, column(), 1));
			}
			throw error;
		}
		return new BdnToken(best, input.substring(pos, bestEnd), line, column(), pos);
	}

	private int matchEnd(TokenType type) {
		if (type.isLiteral()) {
			return input.startsWith(type.literal(), pos) ? pos + type.literal().length() : -1;
		}
		if (type == TokenType.SHELL && pos != 0) {
			return -1;
		}
		if (type == TokenType.TEXT) {
			return scanText();
		}
		if (type == TokenType.TEXT_BLOCK) {
			return scanTextBlock();
		}
		Pattern pattern = PATTERNS.get(type);
		if (pattern == null) {
			return -1;
		}
		Matcher matcher = pattern.matcher(input).region(pos, input.length());
		if (!matcher.lookingAt()) {
			return -1;
		}
		if (type == TokenType.RESOURCE && !isUri(input.substring(pos + 1, matcher.end() - 1))) {
			return -1;
		}
		return matcher.end();
	}

	/**
	 * {@code "} then escapes or characters other than a quote, backslash or line break, then {@code "}.
	 */
	private int scanText() {
		if (input.charAt(pos) != '"') {
			return -1;
		}
		int i = pos + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '"') {
				return i + 1;
			}
			if (c == '\\') {
				if (i + 1 == input.length() || isLineTerminator(input.charAt(i + 1))) {
					return -1;
				}
				i += 2;
			} else if (c == '\r' || c == '\n') {
				return -1;
			} else {
				i++;
			}
		}
		return -1;
	}

	/**
	 * {@code "} and a line break, any escaped content, then a line break, optional spaces and {@code "}.
	 */
	private int scanTextBlock() {
		if (input.charAt(pos) != '"') {
			return -1;
		}
		int body = pos + 1;
		if (input.startsWith("\r\n", body)) {
			body += 2;
		} else if (input.startsWith("\n", body)) {
			body++;
		} else {
			return -1;
		}
		int i = body;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '"') {
				break;
			}
			if (c == '\\') {
				if (i + 1 == input.length() || isLineTerminator(input.charAt(i + 1))) {
					return -1;
				}
				i += 2;
			} else {
				i++;
			}
		}
		if (i == input.length()) {
			return -1;
		}
		int close = i;
		while (close > body && input.charAt(close - 1) == ' ') {
			close--;
		}
		// the closing line break may not be the opening one
		if (close == body || input.charAt(close - 1) != '\n') {
			return -1;
		}
		return i + 1;
	}

	private static boolean isLineTerminator(char c) {
		return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
	}

	private static boolean isUri(String text) {
		try {
			new URI(text);
			return true;
		} catch (URISyntaxException e) {
			return false;
		}
	}

	private void consume(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = pos + i + 1;
			}
		}
		pos += text.length();
	}

	private int column() {
		return pos - lineStart + 1;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static Map<TokenType, Pattern> patterns() {
		Map<TokenType, Pattern> patterns = new EnumMap<>(TokenType.class);
		patterns.put(TokenType.SHELL, Pattern.compile("#![^\\r\\n]*"));
		// base 32 omits E, I, O and U
		patterns.put(TokenType.TAG, Pattern.compile("#[0-9A-DF-HJ-NP-TV-Z]*"));
		patterns.put(TokenType.SYMBOL, Pattern.compile("\\$[a-zA-Z][a-zA-Z0-9]*"));
		patterns.put(TokenType.FRACTION, Pattern.compile("\\.[0-9]*[1-9]"));
		patterns.put(TokenType.CONSTANT, Pattern.compile("e|pi|phi"));
		patterns.put(TokenType.FLOAT, Pattern.compile(
				"(?:-0\\.[0-9]*[1-9]|(?:0|-?[1-9][0-9]*)(?:\\.[0-9]*[1-9])?)(?:E-?[1-9][0-9]*)?"));
		patterns.put(TokenType.MOMENT, Pattern.compile(
				"<-?(?:0|[1-9][0-9]*)"
						+ "(?:-(?:0[1-9]|1[0-2])"
						+ "(?:-(?:0[1-9]|[12][0-9]|3[01])"
						+ "(?:T(?:[01][0-9]|2[0-3])"
						+ "(?::[0-5][0-9]"
						+ "(?::(?:[0-5][0-9]|60)(?:\\.[0-9]*[1-9])?)?)?)?)?)?>"));
		patterns.put(TokenType.DURATION, Pattern.compile(
				"~P(?:" + TIMESPAN + "W"
						+ "|(?:" + TIMESPAN + "Y)?(?:" + TIMESPAN + "M)?(?:" + TIMESPAN + "D)?"
						+ "(?:T(?:" + TIMESPAN + "H)?(?:" + TIMESPAN + "M)?(?:" + TIMESPAN + "S)?)?)"
						+ "(?<![PT])"));
		patterns.put(TokenType.RESOURCE, Pattern.compile(
				"<[a-zA-Z][a-zA-Z0-9+.\\-]*:[A-Za-z0-9\\-._~:/?#@!$&'()*+,;=%]+>"));
		patterns.put(TokenType.VERSION, Pattern.compile("v[1-9][0-9]*(?:\\.[1-9][0-9]*)*"));
		patterns.put(TokenType.BINARY, Pattern.compile("'[A-Za-z0-9+/ \\r\\n]*(?:==?)?[ \\r\\n]*'"));
		patterns.put(TokenType.IDENTIFIER, Pattern.compile("[a-zA-Z][a-zA-Z0-9]*"));
		patterns.put(TokenType.NEWLINE, Pattern.compile("\\r?\\n"));
		patterns.put(TokenType.SPACE, Pattern.compile("[ \\t]+"));
		return patterns;
	}
}
