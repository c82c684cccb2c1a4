package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * Common shape of plain and asynchronous function definitions.
 */
public interface FunctionScope extends Statement {

    String name();

    List<SyntaxNode> body();

    @Override
    default List<SyntaxNode> children() {
        return body();
    }
}
