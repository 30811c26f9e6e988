package org.javai.bali.tree;

/**
 * A node of the Bali Document Notation AST: either a {@link Terminal} or a {@link Tree}.
 * Nodes are immutable.
 */
public sealed interface BdnNode permits Terminal, Tree {

	NodeType type();

	/**
	 * Size weight used by the formatter to choose between inline and multi-line output.
	 */
	int size();

	<R> R accept(BdnNodeVisitor<R> visitor);
}
