package org.javai.bali;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.parse.BdnLexicalException;
import org.javai.bali.parse.BdnSyntaxException;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Tree;
import org.javai.bali.value.Symbol;
import org.junit.jupiter.api.Test;

class BdnParserTest {

	private final BdnParser parser = new BdnParser();

	@Test
	void documentToValue() {
		BdnNode document = parser.parseDocument("\n[$name: \"Alice\", $age: 42]\n\n");

		assertThat(parser.toValue(document))
				.isEqualTo(Map.of(new Symbol("name"), "Alice", new Symbol("age"), 42L));
	}

	@Test
	void entryPointsReturnTheirNodeType() {
		assertThat(parser.parseComponent("[1]").type()).isEqualTo(NodeType.STRUCTURE);
		assertThat(parser.parseElement("$x").type()).isEqualTo(NodeType.SYMBOL);
		assertThat(parser.parseStructure("[1](2)").type()).isEqualTo(NodeType.STRUCTURE);
		assertThat(parser.parseBlock("{}").type()).isEqualTo(NodeType.BLOCK);
		assertThat(parser.parseParameters("($a: 1)").type()).isEqualTo(NodeType.PARAMETERS);
		assertThat(parser.parseRange("1..5").type()).isEqualTo(NodeType.RANGE);
		assertThat(parser.parseArray("1, 2").type()).isEqualTo(NodeType.ARRAY);
		assertThat(parser.parseTable("$a: 1").type()).isEqualTo(NodeType.TABLE);
		assertThat(parser.parseAssociation("$a: 1").type()).isEqualTo(NodeType.ASSOCIATION);
		assertThat(parser.parseProcedure("$x := 1; return $x").type()).isEqualTo(NodeType.PROCEDURE);
		assertThat(parser.parseStatement("return").type()).isEqualTo(NodeType.STATEMENT);
		assertThat(parser.parseExpression("2 ^ 3").type()).isEqualTo(NodeType.EXPONENTIAL_EXPRESSION);
		assertThat(parser.parseTask("#!/bali\nreturn\n").type()).isEqualTo(NodeType.TASK);
	}

	@Test
	void procedureKeepsStatementOrder() {
		Tree procedure = (Tree) parser.parseProcedure("$x := 1; $y := 2; return $y");

		assertThat(procedure.children()).hasSize(3);
		assertThat(((Tree) procedure.child(2)).child(0).type()).isEqualTo(NodeType.RETURN_CLAUSE);
	}

	@Test
	void lexicalErrorPropagates() {
		assertThatThrownBy(() -> parser.parseDocument("[1, ~]"))
				.isInstanceOf(BdnLexicalException.class)
				.isInstanceOf(BdnException.class);
	}

	@Test
	void syntaxErrorPropagates() {
		assertThatThrownBy(() -> parser.parseDocument("[1, 2"))
				.isInstanceOf(BdnSyntaxException.class)
				.isInstanceOf(BdnException.class);
		assertThatThrownBy(() -> parser.parseExpression("1 +"))
				.isInstanceOf(BdnSyntaxException.class);
	}

	@Test
	void nullSourceIsRejected() {
		assertThatThrownBy(() -> parser.parseDocument(null)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new BdnParser(null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void optionsReachTheFormatter() {
		BdnParser narrow = new BdnParser(BdnOptions.builder().maxInlineSize(0).build());

		assertThat(narrow.options().maxInlineSize()).isZero();
		assertThat(narrow.formatDocument(narrow.parseDocument("[1, 2]"))).isEqualTo("[\n    1\n    2\n]\n");
		assertThat(parser.format(parser.parseDocument("[1, 2]"))).isEqualTo("[1, 2]");
	}

	@Test
	void formattedDocumentParsesToTheSameTree() {
		BdnNode document = parser.parseDocument("[$a: [1, 2, 3], $b: {return $a}]");

		assertThat(parser.parseDocument(parser.formatDocument(document))).isEqualTo(document);
		assertThat(parser.toValue(parser.parseDocument("[[1], [2]]"))).isEqualTo(List.of(List.of(1L), List.of(2L)));
	}
}
