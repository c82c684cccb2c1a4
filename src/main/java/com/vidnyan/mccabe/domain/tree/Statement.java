package com.vidnyan.mccabe.domain.tree;

/**
 * Marker for statement-kind nodes.
 * A statement without a dedicated handler counts as one simple statement.
 */
public interface Statement extends SyntaxNode {
}
