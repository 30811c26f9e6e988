package org.javai.bali.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.bali.BdnParser;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Terminal;
import org.javai.bali.tree.Tree;
import org.junit.jupiter.api.Test;

class BdnFormatterTest {

	private final BdnParser parser = new BdnParser();
	private final BdnFormatter formatter = new BdnFormatter();

	@Test
	void documentEndsWithLineBreak() {
		assertThat(formatter.formatDocument(parser.parseDocument("[1,2,3]"))).isEqualTo("[1, 2, 3]\n");
	}

	@Test
	void newlineArrayThatFitsIsWrittenInline() {
		assertThat(formatter.format(parser.parseDocument("[\n1\n2\n3\n]"))).isEqualTo("[1, 2, 3]");
	}

	@Test
	void emptyComposites() {
		assertThat(formatter.format(parser.parseDocument("[\n]"))).isEqualTo("[]");
		assertThat(formatter.format(parser.parseDocument("[ : ]"))).isEqualTo("[:]");
		assertThat(formatter.format(parser.parseDocument("{ }"))).isEqualTo("{}");
	}

	@Test
	void largeTableIsWrittenOnePerLine() {
		String source = "[$first: \"abcdefghijklmnopqrstuvwxyz\", $second: \"abcdefghijklmnopqrstuvwxyz\"]";

		assertThat(formatter.format(parser.parseDocument(source))).isEqualTo("""
				[
				    $first: "abcdefghijklmnopqrstuvwxyz"
				    $second: "abcdefghijklmnopqrstuvwxyz"
				]""");
	}

	@Test
	void inlineThresholdIsConfigurable() {
		BdnFormatter narrow = new BdnFormatter(BdnOptions.builder().maxInlineSize(5).indentation(2).build());

		assertThat(narrow.format(parser.parseDocument("[1, 2, 3]"))).isEqualTo("[\n  1\n  2\n  3\n]");
	}

	@Test
	void inlineProcedureIsWrittenOnePerLine() {
		assertThat(formatter.format(parser.parseDocument("{$x := 1; return $x}")))
				.isEqualTo("{\n    $x := 1\n    return $x\n}");
	}

	@Test
	void nestedBlocksIndentByDepth() {
		BdnNode statement = parser.parseStatement("while true do {if $x then {break}}");

		assertThat(formatter.format(statement)).isEqualTo("""
				while true do {
				    if $x then {
				        break
				    }
				}""");
	}

	@Test
	void binaryOperatorsAreSpaced() {
		assertThat(formatter.format(parser.parseExpression("a+b*c"))).isEqualTo("a + b * c");
		assertThat(formatter.format(parser.parseExpression("x?y"))).isEqualTo("x ? y");
	}

	@Test
	void prefixOperatorSpacingPreservesLexing() {
		assertThat(formatter.format(parser.parseExpression("- 5"))).isEqualTo("- 5");
		assertThat(formatter.format(parser.parseExpression("- x"))).isEqualTo("-x");
		assertThat(formatter.format(parser.parseExpression("/ /x"))).isEqualTo("/ /x");
		assertThat(formatter.format(parser.parseExpression("not    x"))).isEqualTo("not x");
	}

	@Test
	void rangeAndParameters() {
		assertThat(formatter.format(parser.parseDocument("[ 1 .. 10 ]( $step : 2 )")))
				.isEqualTo("[1..10]($step: 2)");
	}

	@Test
	void textBlockIsReindented() {
		BdnNode node = parser.parseDocument("[\n\"\nline one\n\n  line two\n\"\n]");

		assertThat(formatter.format(node)).isEqualTo("[\n    \"\n    line one\n\n      line two\n    \"\n]");
	}

	@Test
	void statementClauses() {
		assertThat(formatter.format(parser.parseStatement("wait  for $m from $q"))).isEqualTo("wait for $m from $q");
		assertThat(formatter.format(parser.parseStatement("label : with $xs do {}")))
				.isEqualTo("label: with $xs do {}");
		assertThat(formatter.format(parser.parseStatement("return"))).isEqualTo("return");
	}

	@Test
	void taskIsWrittenFlushLeft() {
		BdnNode task = parser.parseTask("#!/bin/bali\n$x := 1\nif $x then {return $x}\n");

		assertThat(formatter.formatDocument(task)).isEqualTo("""
				#!/bin/bali
				$x := 1
				if $x then {
				    return $x
				}
				""");
	}

	@Test
	void formattingTwiceGivesTheSameText() {
		BdnNode node = parser.parseDocument("[$a: [1, 2], $b: {return none}]");

		assertThat(formatter.format(node)).isEqualTo(formatter.format(node));
	}

	@Test
	void handBuiltTree() {
		Tree product = Tree.builder(NodeType.ARITHMETIC_EXPRESSION)
				.add(new Terminal(NodeType.NUMBER, "6"))
				.add(new Terminal(NodeType.VARIABLE, "x"))
				.operator("*")
				.build();

		assertThat(formatter.format(product)).isEqualTo("6 * x");
	}

	@Test
	void nullOptionsAreRejected() {
		assertThatThrownBy(() -> new BdnFormatter(null)).isInstanceOf(IllegalArgumentException.class);
	}
}
