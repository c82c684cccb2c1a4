package com.vidnyan.mccabe.domain.tree;

/**
 * Non-statement leaf. Ignored by the graph builder.
 */
public record ExpressionNode(String kind, Integer line, int column) implements SyntaxNode {
}
