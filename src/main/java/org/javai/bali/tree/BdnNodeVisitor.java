package org.javai.bali.tree;

/**
 * Visitor over AST nodes. Implementations switch on {@link NodeType} to handle each construct.
 *
 * @param <R> the result type
 */
public interface BdnNodeVisitor<R> {

	R visitTerminal(Terminal terminal);

	R visitTree(Tree tree);
}
