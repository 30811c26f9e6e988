package org.javai.bali.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class BdnTokenizerTest {

	private static List<TokenType> types(String source) {
		return new BdnTokenizer(source).tokenize().stream().map(BdnToken::type).toList();
	}

	@Test
	void tokenizeEmptyString() {
		List<BdnToken> tokens = new BdnTokenizer("").tokenize();

		assertThat(tokens).hasSize(1);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.EOF);
	}

	@Test
	void tokenizeNullInput() {
		assertThat(types(null)).containsExactly(TokenType.EOF);
	}

	@Test
	void spacesAreNotEmitted() {
		assertThat(types("  [ 1 ,\t2 ]  ")).containsExactly(
				TokenType.OPEN_BRACKET, TokenType.FLOAT, TokenType.COMMA, TokenType.FLOAT,
				TokenType.CLOSE_BRACKET, TokenType.EOF);
	}

	@Test
	void newlinesAreEmitted() {
		assertThat(types("[\n1\r\n]")).containsExactly(
				TokenType.OPEN_BRACKET, TokenType.NEWLINE, TokenType.FLOAT, TokenType.NEWLINE,
				TokenType.CLOSE_BRACKET, TokenType.EOF);
	}

	@Test
	void versionIsASingleToken() {
		List<BdnToken> tokens = new BdnTokenizer("v1.2.3").tokenize();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.VERSION);
		assertThat(tokens.get(0).text()).isEqualTo("v1.2.3");
	}

	@Test
	void versionWithZeroLevelIsNotAVersion() {
		assertThat(types("v0")).containsExactly(TokenType.IDENTIFIER, TokenType.EOF);
	}

	@Test
	void keywordsWinTiesWithIdentifiers() {
		assertThat(types("if in i item")).containsExactly(
				TokenType.IF, TokenType.IN, TokenType.IMAGINARY_UNIT, TokenType.IDENTIFIER, TokenType.EOF);
	}

	@Test
	void longestMatchWins() {
		assertThat(types("e e^ := : // / ..")).containsExactly(
				TokenType.CONSTANT, TokenType.POLAR, TokenType.ASSIGN, TokenType.COLON,
				TokenType.DOUBLE_SLASH, TokenType.SLASH, TokenType.DOT_DOT, TokenType.EOF);
	}

	@Test
	void negativeNumberIsOneToken() {
		List<BdnToken> tokens = new BdnTokenizer("x - -5").tokenize();

		assertThat(tokens).extracting(BdnToken::type).containsExactly(
				TokenType.IDENTIFIER, TokenType.MINUS, TokenType.FLOAT, TokenType.EOF);
		assertThat(tokens.get(2).text()).isEqualTo("-5");
	}

	@Test
	void textWithLeadingLineBreakIsATextBlock() {
		List<BdnToken> tokens = new BdnTokenizer("\"\n    hello\n\"").tokenize();

		assertThat(tokens.get(0).type()).isEqualTo(TokenType.TEXT_BLOCK);
		assertThat(tokens.get(0).text()).isEqualTo("\"\n    hello\n\"");
	}

	@Test
	void textWithoutLeadingLineBreakIsText() {
		List<BdnToken> tokens = new BdnTokenizer("\"hello \\\"world\\\"\"").tokenize();

		assertThat(tokens.get(0).type()).isEqualTo(TokenType.TEXT);
		assertThat(tokens.get(0).text()).isEqualTo("\"hello \\\"world\\\"\"");
	}

	@Test
	void longTextIsOneToken() {
		String text = "\"" + "a".repeat(100_000) + "\\\"" + "b".repeat(100_000) + "\"";

		List<BdnToken> tokens = new BdnTokenizer(text).tokenize();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.TEXT);
		assertThat(tokens.get(0).text()).hasSize(200_004);
	}

	@Test
	void longTextBlockIsOneToken() {
		String block = "\"\n" + "    a line of text\n".repeat(20_000) + "    \"";

		List<BdnToken> tokens = new BdnTokenizer(block).tokenize();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.TEXT_BLOCK);
		assertThat(tokens.get(1).line()).isEqualTo(20_002);
	}

	@Test
	void textBlockMayContainEscapedQuotes() {
		assertThat(types("\"\nsay \\\"hi\\\"\n\"")).containsExactly(TokenType.TEXT_BLOCK, TokenType.EOF);
	}

	@Test
	void textBlockClosingQuoteMustStartItsOwnLine() {
		assertThatThrownBy(() -> new BdnTokenizer("\"\nhello\"").tokenize())
				.isInstanceOf(BdnLexicalException.class);
		assertThatThrownBy(() -> new BdnTokenizer("\"\n\"").tokenize())
				.isInstanceOf(BdnLexicalException.class);
	}

	@Test
	void unterminatedTextIsRejected() {
		assertThatThrownBy(() -> new BdnTokenizer("\"hello").tokenize())
				.isInstanceOf(BdnLexicalException.class);
		assertThatThrownBy(() -> new BdnTokenizer("\"hello\nworld\"").tokenize())
				.isInstanceOf(BdnLexicalException.class);
	}

	@Test
	void resourceMustBeAValidUri() {
		assertThat(types("<bali:/documents/7?version=2#summary>"))
				.containsExactly(TokenType.RESOURCE, TokenType.EOF);
		assertThat(types("<bali:a|b>").get(0)).isEqualTo(TokenType.LESS);
		assertThat(types("<bali:a#b#c>").get(0)).isEqualTo(TokenType.LESS);
	}

	@Test
	void fractionMustEndWithNonZeroDigit() {
		List<BdnToken> tokens = new BdnTokenizer(".10").tokenize();

		assertThat(tokens.get(0).type()).isEqualTo(TokenType.FRACTION);
		assertThat(tokens.get(0).text()).isEqualTo(".1");
		assertThat(tokens.get(1).type()).isEqualTo(TokenType.FLOAT);
		assertThat(tokens.get(1).text()).isEqualTo("0");
	}

	@Test
	void fractionOfZeroesIsNotAFraction() {
		assertThat(types(".0")).containsExactly(TokenType.DOT, TokenType.FLOAT, TokenType.EOF);
	}

	@Test
	void tokenizeElementLiterals() {
		assertThat(types("#VHF9Z3 $name <2024-03-01T12:30> ~P3DT4H <https://example.com/a> 'AQID' .25 none"))
				.containsExactly(TokenType.TAG, TokenType.SYMBOL, TokenType.MOMENT, TokenType.DURATION,
						TokenType.RESOURCE, TokenType.BINARY, TokenType.FRACTION, TokenType.NONE, TokenType.EOF);
	}

	@Test
	void multiLineBinaryIsOneToken() {
		List<BdnToken> tokens = new BdnTokenizer("'\n    AQID\n    BAUG\n'").tokenize();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.BINARY);
	}

	@Test
	void shellOnlyMatchesAtStart() {
		assertThat(types("#!/bin/bali\nreturn")).containsExactly(
				TokenType.SHELL, TokenType.NEWLINE, TokenType.RETURN, TokenType.EOF);
		assertThat(types("x #!")).containsExactly(
				TokenType.IDENTIFIER, TokenType.TAG, TokenType.BANG, TokenType.EOF);
	}

	@Test
	void tokenPositionsAreTracked() {
		List<BdnToken> tokens = new BdnTokenizer("[\n    $a: 1\n]").tokenize();

		BdnToken symbol = tokens.get(2);
		assertThat(symbol.type()).isEqualTo(TokenType.SYMBOL);
		assertThat(symbol.line()).isEqualTo(2);
		assertThat(symbol.column()).isEqualTo(5);
		assertThat(symbol.offset()).isEqualTo(6);
		BdnToken close = tokens.get(6);
		assertThat(close.type()).isEqualTo(TokenType.CLOSE_BRACKET);
		assertThat(close.line()).isEqualTo(3);
		assertThat(close.column()).isEqualTo(1);
	}

	@Test
	void unexpectedCharacterReportsPosition() {
		assertThatThrownBy(() -> new BdnTokenizer("[1, 2, ~]").tokenize())
				.isInstanceOf(BdnLexicalException.class)
				.hasMessage("LEXER: An unexpected character was encountered: '~' (line 1, column 8)")
				.satisfies(e -> {
					BdnLexicalException error = (BdnLexicalException) e;
					assertThat(error.line()).isEqualTo(1);
					assertThat(error.column()).isEqualTo(8);
					assertThat(error.character()).isEqualTo('~');
				});
	}

	@Test
	void debugModeLogsExcerpt() {
		BdnOptions options = BdnOptions.builder().debug(true).build();
		try (LogCaptorAppender captor = LogCaptorAppender.create(Level.DEBUG, BdnTokenizer.class)) {
			assertThatThrownBy(() -> new BdnTokenizer("[1, 2]\n[3, ~]\n[4]", options).tokenize())
					.isInstanceOf(BdnLexicalException.class);

			assertThat(captor.messages()).hasSize(1);
			assertThat(captor.messages().get(0)).isEqualTo(
					"LEXER: An unexpected character was encountered: '~' (line 2, column 5)\n"
							+ "[1, 2]\n"
							+ "[3, ~]\n"
							+ "    ^\n"
							+ "[4]");
		}
	}

	@Test
	void productionModeLogsNothing() {
		try (LogCaptorAppender captor = LogCaptorAppender.create(Level.DEBUG, BdnTokenizer.class)) {
			assertThatThrownBy(() -> new BdnTokenizer("~").tokenize())
					.isInstanceOf(BdnLexicalException.class);

			assertThat(captor.messages()).isEmpty();
		}
	}
}
