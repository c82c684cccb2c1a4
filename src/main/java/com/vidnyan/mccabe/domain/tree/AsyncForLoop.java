package com.vidnyan.mccabe.domain.tree;

import java.util.List;

public record AsyncForLoop(Integer line, int column, List<SyntaxNode> body, List<SyntaxNode> orelse)
        implements BranchingConstruct {

    public AsyncForLoop {
        body = Bodies.copyOf(body);
        orelse = Bodies.copyOf(orelse);
    }

    public AsyncForLoop(Integer line, int column, List<SyntaxNode> body) {
        this(line, column, body, List.of());
    }
}
