package com.vidnyan.mccabe.domain.graph;

/**
 * A vertex of a control-flow graph.
 * Equality is identity: two nodes with the same label are distinct vertices.
 */
public final class PathNode {

    private final String name;
    private final NodeKind kind;

    public PathNode(String name, NodeKind kind) {
        this.name = name == null ? "" : name;
        this.kind = kind == null ? NodeKind.STATEMENT : kind;
    }

    public static PathNode statement(String name) {
        return new PathNode(name, NodeKind.STATEMENT);
    }

    public static PathNode decision(String name) {
        return new PathNode(name, NodeKind.DECISION);
    }

    /**
     * Anonymous node where branches reconverge.
     */
    public static PathNode join() {
        return new PathNode("", NodeKind.JOIN);
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind == NodeKind.JOIN ? "<join>" : name;
    }
}
