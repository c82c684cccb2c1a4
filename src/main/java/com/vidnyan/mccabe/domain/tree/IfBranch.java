package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * Conditional. An elif chain is an {@code IfBranch} as the only element of the else-body.
 */
public record IfBranch(Integer line, int column, List<SyntaxNode> body, List<SyntaxNode> orelse)
        implements BranchingConstruct {

    public IfBranch {
        body = Bodies.copyOf(body);
        orelse = Bodies.copyOf(orelse);
    }

    public IfBranch(Integer line, int column, List<SyntaxNode> body) {
        this(line, column, body, List.of());
    }
}
