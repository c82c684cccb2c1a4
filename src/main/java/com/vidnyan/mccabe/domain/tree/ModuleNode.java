package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * Root of one source unit. Not a statement.
 */
public record ModuleNode(String name, List<SyntaxNode> body) implements SyntaxNode {

    public ModuleNode {
        body = Bodies.copyOf(body);
    }

    @Override
    public Integer line() {
        return 0;
    }

    @Override
    public int column() {
        return 0;
    }

    @Override
    public List<SyntaxNode> children() {
        return body;
    }
}
