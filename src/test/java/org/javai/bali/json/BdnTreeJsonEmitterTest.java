package org.javai.bali.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.bali.BdnParser;
import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Terminal;
import org.junit.jupiter.api.Test;

class BdnTreeJsonEmitterTest {

	private final BdnParser parser = new BdnParser();

	@Test
	void terminalHasTypeAndValue() {
		ObjectNode json = BdnTreeJsonEmitter.emit(new Terminal(NodeType.SYMBOL, "$name"));

		assertThat(json.get("type").asText()).isEqualTo("SYMBOL");
		assertThat(json.get("value").asText()).isEqualTo("$name");
		assertThat(json.has("children")).isFalse();
	}

	@Test
	void operatorTreeCarriesOperatorAndSize() {
		ObjectNode json = BdnTreeJsonEmitter.emit(parser.parseExpression("a + 10"));

		assertThat(json.get("type").asText()).isEqualTo("ARITHMETIC_EXPRESSION");
		assertThat(json.get("operator").asText()).isEqualTo("+");
		assertThat(json.get("size").asInt()).isEqualTo(6);
		assertThat(json.get("children")).hasSize(2);
		assertThat(json.get("children").get(1).get("value").asText()).isEqualTo("10");
	}

	@Test
	void treeWithoutOperatorOmitsIt() {
		ObjectNode json = BdnTreeJsonEmitter.emit(parser.parseDocument("[1, 2]"));

		assertThat(json.get("type").asText()).isEqualTo("STRUCTURE");
		assertThat(json.has("operator")).isFalse();
		assertThat(json.at("/children/0/type").asText()).isEqualTo("ARRAY");
		assertThat(json.at("/children/0/children/1/value").asText()).isEqualTo("2");
	}

	@Test
	void emitStringIsParsableJson() throws Exception {
		String text = BdnTreeJsonEmitter.emitString(parser.parseStatement("return $x"));

		JsonNode json = new ObjectMapper().readTree(text);
		assertThat(json.get("type").asText()).isEqualTo("STATEMENT");
		assertThat(json.at("/children/0/type").asText()).isEqualTo("RETURN_CLAUSE");
		assertThat(text).contains("\n");
	}
}
