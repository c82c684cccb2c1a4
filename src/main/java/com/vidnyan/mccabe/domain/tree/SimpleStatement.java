package com.vidnyan.mccabe.domain.tree;

/**
 * Any statement without control-flow significance: assignment, return, call, switch selector...
 *
 * @param kind front-end specific construct name, informational only
 */
public record SimpleStatement(String kind, Integer line, int column) implements Statement {

    public static SimpleStatement at(int line) {
        return new SimpleStatement("Statement", line, 0);
    }
}
