package com.vidnyan.mccabe.domain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control-flow graph of one function scope or one orphan top-level region.
 * Populated incrementally while its scope is traversed, then sealed.
 * <p>
 * Every node that ever takes part in {@link #connect} is a key of the
 * adjacency map, so {@code edges - nodes + 2} is the McCabe number of the graph.
 */
public final class PathGraph {

    private final String name;
    private final String entity;
    private final int line;
    private final int column;
    private final Map<PathNode, List<PathNode>> adjacency = new LinkedHashMap<>();
    private boolean sealed;

    public PathGraph(String name, String entity, int line, int column) {
        this.name = name;
        this.entity = entity;
        this.line = line;
        this.column = column;
    }

    /**
     * Add an edge. Both ends become known nodes; an existing successor list is kept.
     */
    public void connect(PathNode from, PathNode to) {
        checkOpen();
        adjacency.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        adjacency.computeIfAbsent(to, k -> new ArrayList<>());
    }

    /**
     * Register a node without edges, e.g. the entry of an empty function.
     */
    public void addNode(PathNode node) {
        checkOpen();
        adjacency.computeIfAbsent(node, k -> new ArrayList<>());
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        int edges = 0;
        for (List<PathNode> successors : adjacency.values()) {
            edges += successors.size();
        }
        return edges;
    }

    /**
     * Cyclomatic complexity: edges - nodes + 2.
     */
    public int complexity() {
        return edgeCount() - nodeCount() + 2;
    }

    public List<PathNode> getSuccessors(PathNode node) {
        List<PathNode> successors = adjacency.get(node);
        return successors == null ? List.of() : Collections.unmodifiableList(successors);
    }

    public boolean contains(PathNode node) {
        return adjacency.containsKey(node);
    }

    public String getName() {
        return name;
    }

    /**
     * Qualified name used in reports.
     */
    public String getEntity() {
        return entity;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Graph is sealed: " + name);
        }
    }

    @Override
    public String toString() {
        return "PathGraph[" + name + ", nodes=" + nodeCount() + ", edges=" + edgeCount() + "]";
    }
}
