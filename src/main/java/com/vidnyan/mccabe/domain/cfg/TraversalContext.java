package com.vidnyan.mccabe.domain.cfg;

import com.vidnyan.mccabe.domain.graph.PathGraph;
import com.vidnyan.mccabe.domain.graph.PathNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one file-level traversal.
 * <p>
 * Closed state: no graph, no tail. Open state: a graph under construction and the
 * node new statements attach after. Completed graphs keep their sealing order.
 */
@Slf4j
public final class TraversalContext {

    private PathGraph currentGraph;
    private PathNode currentTail;
    private String qualifiedPrefix = "";
    private final Map<String, PathGraph> completedGraphs = new LinkedHashMap<>();

    public boolean isGraphOpen() {
        return currentGraph != null;
    }

    public PathNode currentTail() {
        return currentTail;
    }

    public String qualifiedPrefix() {
        return qualifiedPrefix;
    }

    /**
     * Start a new top-level graph whose flow begins at {@code entry}.
     */
    void open(PathGraph graph, PathNode entry) {
        if (currentGraph != null) {
            throw new IllegalStateException("Graph already open: " + currentGraph.getName());
        }
        graph.addNode(entry);
        currentGraph = graph;
        currentTail = entry;
    }

    /**
     * Seal the open graph, register it under {@code key} and return to the closed state.
     *
     * @return the key actually used; a taken key gets a {@code #n} suffix
     */
    String sealAndRegister(String key) {
        PathGraph graph = currentGraph;
        graph.seal();
        String registeredKey = key;
        int ordinal = 1;
        while (completedGraphs.containsKey(registeredKey)) {
            registeredKey = key + "#" + (++ordinal);
        }
        if (!registeredKey.equals(key)) {
            log.debug("Qualified name {} already registered, using {}", key, registeredKey);
        }
        completedGraphs.put(registeredKey, graph);
        reset();
        return registeredKey;
    }

    void reset() {
        currentGraph = null;
        currentTail = null;
    }

    /**
     * Attach {@code node} after the current tail and make it the new tail.
     * No-op without an open graph.
     *
     * @return the appended node, or null when nothing was open
     */
    PathNode append(PathNode node) {
        if (currentGraph == null || currentTail == null) {
            return null;
        }
        currentGraph.connect(currentTail, node);
        currentTail = node;
        return node;
    }

    void moveTail(PathNode node) {
        currentTail = node;
    }

    /**
     * Connect every loose end to a fresh join node, which becomes the tail.
     */
    PathNode joinAt(List<PathNode> looseEnds) {
        PathNode bottom = PathNode.join();
        for (PathNode end : looseEnds) {
            currentGraph.connect(end, bottom);
        }
        currentTail = bottom;
        return bottom;
    }

    /**
     * Extend the prefix by one class name.
     *
     * @return the previous prefix, to hand back to {@link #restorePrefix}
     */
    String enterClass(String className) {
        String previous = qualifiedPrefix;
        qualifiedPrefix = previous + className + ".";
        return previous;
    }

    void restorePrefix(String previous) {
        qualifiedPrefix = previous;
    }

    public Map<String, PathGraph> completedGraphs() {
        return Collections.unmodifiableMap(completedGraphs);
    }
}
