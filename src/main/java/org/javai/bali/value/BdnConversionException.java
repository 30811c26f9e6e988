package org.javai.bali.value;

import org.javai.bali.BdnException;
import org.javai.bali.tree.NodeType;

/**
 * Thrown when a node that denotes code rather than data is asked for its static value.
 */
public class BdnConversionException extends BdnException {

	private final NodeType nodeType;

	public BdnConversionException(NodeType nodeType) {
		super("TRANSFORMER: The " + nodeType + " node cannot be converted into a static value.");
		this.nodeType = nodeType;
	}

	public NodeType nodeType() {
		return nodeType;
	}
}
