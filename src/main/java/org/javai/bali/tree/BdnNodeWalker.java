package org.javai.bali.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Utility class for walking AST nodes with visitors.
 */
public final class BdnNodeWalker {

	private BdnNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a node before its children.
	 *
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPreOrder(BdnNode node, BdnNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}
		R result = node.accept(visitor);
		if (node instanceof Tree tree) {
			for (BdnNode child : tree.children()) {
				walkPreOrder(child, visitor);
			}
		}
		return result;
	}

	/**
	 * Visits a node after its children.
	 *
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPostOrder(BdnNode node, BdnNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}
		if (node instanceof Tree tree) {
			for (BdnNode child : tree.children()) {
				walkPostOrder(child, visitor);
			}
		}
		return node.accept(visitor);
	}

	/**
	 * Collects, in pre-order, every node under {@code root} (itself included) that matches.
	 */
	public static List<BdnNode> collect(BdnNode root, Predicate<BdnNode> predicate) {
		List<BdnNode> matches = new ArrayList<>();
		walkPreOrder(root, new BdnNodeVisitor<Void>() {
			@Override
			public Void visitTerminal(Terminal terminal) {
				if (predicate.test(terminal)) {
					matches.add(terminal);
				}
				return null;
			}

			@Override
			public Void visitTree(Tree tree) {
				if (predicate.test(tree)) {
					matches.add(tree);
				}
				return null;
			}
		});
		return matches;
	}

	/**
	 * Whether any node under {@code root} (itself included) has the given type.
	 */
	public static boolean contains(BdnNode root, NodeType type) {
		return !collect(root, node -> node.type() == type).isEmpty();
	}
}
