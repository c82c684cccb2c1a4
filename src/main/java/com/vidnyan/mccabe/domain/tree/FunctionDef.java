package com.vidnyan.mccabe.domain.tree;

import java.util.List;

public record FunctionDef(String name, Integer line, int column, List<SyntaxNode> body) implements FunctionScope {

    public FunctionDef {
        body = Bodies.copyOf(body);
    }
}
