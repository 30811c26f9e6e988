package org.javai.bali.tree;

/**
 * A leaf of the AST holding the canonical text of a literal, name or label.
 *
 * @param type a terminal node type
 * @param value the canonical lexeme
 */
public record Terminal(NodeType type, String value) implements BdnNode {

	static final int MULTILINE_SIZE = 100;

	public Terminal {
		if (type == null || !type.isTerminal()) {
			throw new IllegalArgumentException("Not a terminal node type: " + type);
		}
		if (value == null) {
			throw new IllegalArgumentException("Terminal value cannot be null");
		}
	}

	/**
	 * The length of the value, or a fixed large weight when the value spans several lines.
	 */
	@Override
	public int size() {
		return value.indexOf('\n') >= 0 ? MULTILINE_SIZE : value.length();
	}

	@Override
	public <R> R accept(BdnNodeVisitor<R> visitor) {
		return visitor.visitTerminal(this);
	}

	@Override
	public String toString() {
		return type + "(" + value + ")";
	}
}
