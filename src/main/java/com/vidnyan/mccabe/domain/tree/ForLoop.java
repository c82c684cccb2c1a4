package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * Counted or iterator loop. The else-body runs when the loop finishes without breaking.
 */
public record ForLoop(Integer line, int column, List<SyntaxNode> body, List<SyntaxNode> orelse)
        implements BranchingConstruct {

    public ForLoop {
        body = Bodies.copyOf(body);
        orelse = Bodies.copyOf(orelse);
    }

    public ForLoop(Integer line, int column, List<SyntaxNode> body) {
        this(line, column, body, List.of());
    }
}
