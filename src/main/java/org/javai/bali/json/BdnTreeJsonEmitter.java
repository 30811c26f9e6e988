package org.javai.bali.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.bali.BdnException;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.Terminal;
import org.javai.bali.tree.Tree;

/**
 * Renders an AST as JSON for diagnostics and tooling.
 * Terminals become {@code {"type", "value"}}; trees become
 * {@code {"type", "operator"?, "size", "children"}}.
 */
public final class BdnTreeJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private BdnTreeJsonEmitter() {}

	public static ObjectNode emit(BdnNode node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("type", node.type().name());
		if (node instanceof Terminal terminal) {
			json.put("value", terminal.value());
			return json;
		}
		Tree tree = (Tree) node;
		if (tree.hasOperator()) {
			json.put("operator", tree.operator());
		}
		json.put("size", tree.size());
		ArrayNode children = json.putArray("children");
		tree.children().forEach(child -> children.add(emit(child)));
		return json;
	}

	public static String emitString(BdnNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(node));
		} catch (JsonProcessingException e) {
			throw new BdnException("Failed to render tree as JSON", e);
		}
	}
}
