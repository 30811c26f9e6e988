package org.javai.bali.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import org.javai.bali.BdnParser;
import org.javai.bali.tree.BdnNode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Canonical source read from the fixture files must survive a parse-format cycle unchanged.
 */
class RoundTripTest {

	private static final BdnParser parser = new BdnParser();

	@ParameterizedTest
	@MethodSource("elements")
	void elementDocument(String entry) {
		assertDocumentRoundTrip(entry);
	}

	@ParameterizedTest
	@MethodSource("components")
	void componentDocument(String entry) {
		assertDocumentRoundTrip(entry);
	}

	@ParameterizedTest
	@MethodSource("expressions")
	void expression(String entry) {
		assertRoundTrip(entry, parser::parseExpression);
	}

	@ParameterizedTest
	@MethodSource("statements")
	void statement(String entry) {
		assertRoundTrip(entry, parser::parseStatement);
	}

	private static void assertDocumentRoundTrip(String entry) {
		String source = entry + "\n";
		BdnNode document = parser.parseDocument(source);
		String formatted = parser.formatDocument(document);

		assertThat(formatted).isEqualTo(source);
		assertThat(parser.parseDocument(formatted)).isEqualTo(document);
	}

	private static void assertRoundTrip(String entry, Function<String, BdnNode> parse) {
		BdnNode node = parse.apply(entry);
		String formatted = parser.format(node);

		assertThat(formatted).isEqualTo(entry);
		assertThat(parse.apply(formatted)).isEqualTo(node);
	}

	static Stream<String> elements() throws IOException {
		return entries("fixtures/elements.bali");
	}

	static Stream<String> components() throws IOException {
		return entries("fixtures/components.bali");
	}

	static Stream<String> expressions() throws IOException {
		return entries("fixtures/expressions.bali");
	}

	static Stream<String> statements() throws IOException {
		return entries("fixtures/statements.bali");
	}

	/**
	 * Entries are separated by a blank line.
	 */
	private static Stream<String> entries(String resource) throws IOException {
		try (InputStream in = RoundTripTest.class.getClassLoader().getResourceAsStream(resource)) {
			assertThat(in).as("fixture %s", resource).isNotNull();
			String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			if (text.endsWith("\n")) {
				text = text.substring(0, text.length() - 1);
			}
			return List.of(text.split("\n\n")).stream();
		}
	}
}
