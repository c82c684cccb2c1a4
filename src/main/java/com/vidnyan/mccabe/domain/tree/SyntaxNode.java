package com.vidnyan.mccabe.domain.tree;

import java.util.List;

/**
 * A node of an already-parsed source tree.
 * Produced by a language front end, consumed by the graph-building visitor.
 */
public interface SyntaxNode {

    /**
     * Source line, or null when the front end could not tell.
     */
    Integer line();

    int column();

    /**
     * Child nodes walked by the default handler, in source order.
     */
    default List<SyntaxNode> children() {
        return List.of();
    }

    default int lineOrZero() {
        Integer line = line();
        return line == null ? 0 : line;
    }
}
