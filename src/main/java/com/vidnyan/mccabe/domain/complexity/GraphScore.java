package com.vidnyan.mccabe.domain.complexity;

import com.vidnyan.mccabe.domain.graph.PathGraph;

/**
 * Complexity of one sealed graph.
 */
public record GraphScore(
    String entity,
    int line,
    int column,
    int complexity
) {

    public static GraphScore of(PathGraph graph) {
        return new GraphScore(graph.getEntity(), graph.getLine(), graph.getColumn(), graph.complexity());
    }
}
