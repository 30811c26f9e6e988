package org.javai.bali.value;

import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Tree;

/**
 * A quoted procedure. The statements are kept as a tree and are never evaluated here.
 */
public record Code(Tree procedure) {

	public Code {
		if (procedure == null || procedure.type() != NodeType.PROCEDURE) {
			throw new IllegalArgumentException("Code requires a PROCEDURE node");
		}
	}

	public boolean isEmpty() {
		return procedure.children().isEmpty();
	}
}
