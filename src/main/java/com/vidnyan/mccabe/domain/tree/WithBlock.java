package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * A guarded block (context manager, try body, synchronized body).
 * Counts as one statement followed by its body; adds no decision.
 */
public record WithBlock(Integer line, int column, List<SyntaxNode> body) implements Statement {

    public WithBlock {
        body = Bodies.copyOf(body);
    }

    @Override
    public List<SyntaxNode> children() {
        return body;
    }
}
