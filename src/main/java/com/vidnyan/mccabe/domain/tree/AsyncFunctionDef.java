package com.vidnyan.mccabe.domain.tree;

import java.util.List;

public record AsyncFunctionDef(String name, Integer line, int column, List<SyntaxNode> body) implements FunctionScope {

    public AsyncFunctionDef {
        body = Bodies.copyOf(body);
    }
}
