package com.vidnyan.mccabe.domain.tree;

import java.util.List;

public record WhileLoop(Integer line, int column, List<SyntaxNode> body, List<SyntaxNode> orelse)
        implements BranchingConstruct {

    public WhileLoop {
        body = Bodies.copyOf(body);
        orelse = Bodies.copyOf(orelse);
    }

    public WhileLoop(Integer line, int column, List<SyntaxNode> body) {
        this(line, column, body, List.of());
    }
}
