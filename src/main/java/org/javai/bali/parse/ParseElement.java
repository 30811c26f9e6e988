package org.javai.bali.parse;

/**
 * A child of a {@link ParseNode}: either a nested rule node or a matched token.
 */
public sealed interface ParseElement permits ParseNode, BdnToken {
}
