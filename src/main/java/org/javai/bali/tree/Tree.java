package org.javai.bali.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * An interior AST node.
 *
 * @param type a tree node type
 * @param children the ordered children
 * @param operator the operator text for operator nodes, otherwise {@code null}
 * @param size the size weight of this subtree
 */
public record Tree(NodeType type, List<BdnNode> children, String operator, int size) implements BdnNode {

	public Tree {
		if (type == null || type.isTerminal()) {
			throw new IllegalArgumentException("Not a tree node type: " + type);
		}
		children = List.copyOf(children);
		if (children.size() < type.minChildren() || children.size() > type.maxChildren()) {
			throw new IllegalArgumentException(type + " cannot have " + children.size() + " children");
		}
		switch (type) {
			case IF_CLAUSE -> requireBlocks(type, children, 0);
			case SELECT_CLAUSE -> requireBlocks(type, children, 1);
			default -> {
			}
		}
	}

	public static Builder builder(NodeType type) {
		return new Builder(type);
	}

	public BdnNode child(int index) {
		return children.get(index);
	}

	public boolean hasOperator() {
		return operator != null;
	}

	@Override
	public <R> R accept(BdnNodeVisitor<R> visitor) {
		return visitor.visitTree(this);
	}

	/**
	 * Checks (test, block) pairs whose first test is at {@code first}, with an optional trailing else block.
	 */
	private static void requireBlocks(NodeType type, List<BdnNode> children, int first) {
		for (int i = first + 1; i < children.size(); i += 2) {
			if (children.get(i).type() != NodeType.BLOCK) {
				throw new IllegalArgumentException(type + " expects a block at position " + i);
			}
		}
		if ((children.size() - first) % 2 == 1 && children.get(children.size() - 1).type() != NodeType.BLOCK) {
			throw new IllegalArgumentException(type + " expects a trailing else block");
		}
	}

	/**
	 * Accumulates children and size; the size starts at the type's weight.
	 */
	public static final class Builder {
		private final NodeType type;
		private final List<BdnNode> children = new ArrayList<>();
		private String operator;
		private int size;

		private Builder(NodeType type) {
			this.type = type;
			this.size = type.weight();
		}

		public Builder add(BdnNode child) {
			children.add(child);
			size += child.size();
			return this;
		}

		public Builder operator(String operator) {
			this.operator = operator;
			return this;
		}

		/**
		 * Adds weight that does not come from a child.
		 */
		public Builder weigh(int extra) {
			size += extra;
			return this;
		}

		public Tree build() {
			return new Tree(type, children, operator, size);
		}
	}
}
