package com.vidnyan.mccabe.domain.graph;

/**
 * Display shape of a CFG vertex. Never used for complexity math.
 */
public enum NodeKind {
    STATEMENT,
    DECISION,
    JOIN
}
