package org.javai.bali.parse;

import java.util.List;

/**
 * A node of the concrete parse tree: the rule that matched, the production chosen, and the
 * matched children in source order.
 */
public record ParseNode(GrammarRule rule, Variant variant, List<ParseElement> children) implements ParseElement {

	public ParseNode {
		children = List.copyOf(children);
	}

	public static ParseNode of(GrammarRule rule, List<ParseElement> children) {
		return new ParseNode(rule, Variant.DEFAULT, children);
	}

	/**
	 * Child rule nodes, skipping tokens.
	 */
	public List<ParseNode> nodes() {
		return children.stream()
				.filter(ParseNode.class::isInstance)
				.map(ParseNode.class::cast)
				.toList();
	}

	/**
	 * Child rule nodes with the given rule.
	 */
	public List<ParseNode> nodes(GrammarRule childRule) {
		return nodes().stream()
				.filter(node -> node.rule() == childRule)
				.toList();
	}

	public ParseNode node(int index) {
		return nodes().get(index);
	}

	/**
	 * Child tokens, skipping rule nodes.
	 */
	public List<BdnToken> tokens() {
		return children.stream()
				.filter(BdnToken.class::isInstance)
				.map(BdnToken.class::cast)
				.toList();
	}

	/**
	 * The first child token of the given kind, or {@code null}.
	 */
	public BdnToken token(TokenType type) {
		return tokens().stream()
				.filter(token -> token.type() == type)
				.findFirst()
				.orElse(null);
	}

	public boolean hasToken(TokenType type) {
		return token(type) != null;
	}

	public boolean hasNode(GrammarRule childRule) {
		return !nodes(childRule).isEmpty();
	}

	/**
	 * The concatenated text of every token under this node.
	 */
	public String text() {
		StringBuilder text = new StringBuilder();
		for (ParseElement child : children) {
			if (child instanceof BdnToken token) {
				text.append(token.text());
			} else {
				text.append(((ParseNode) child).text());
			}
		}
		return text.toString();
	}
}
