package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * Class scope. Only contributes to qualified names, never to control flow.
 */
public record ClassDef(String name, Integer line, int column, List<SyntaxNode> body) implements Statement {

    public ClassDef {
        body = Bodies.copyOf(body);
    }

    @Override
    public List<SyntaxNode> children() {
        return body;
    }
}
