package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * A loop or conditional: a primary body plus an optional else-body.
 */
public interface BranchingConstruct extends Statement {

    List<SyntaxNode> body();

    /**
     * Else-clause statements; empty when the construct has none.
     */
    List<SyntaxNode> orelse();

    @Override
    default List<SyntaxNode> children() {
        return body();
    }
}
