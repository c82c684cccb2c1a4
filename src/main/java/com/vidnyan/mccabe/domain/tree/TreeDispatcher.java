package com.vidnyan.mccabe.domain.tree;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Dispatches syntax nodes to handlers keyed by their concrete type.
 * Resolution: exact type if registered, otherwise the default handler.
 * Resolutions are cached per concrete type for the lifetime of the dispatcher.
 *
 * @param <C> traversal context passed to every handler
 * @param <R> handler result
 */
public class TreeDispatcher<C, R> {

    @FunctionalInterface
    public interface Handler<N extends SyntaxNode, C, R> {
        R handle(N node, C context);
    }

    private final Map<Class<?>, Handler<?, C, R>> handlers = new HashMap<>();
    private final Map<Class<?>, Handler<SyntaxNode, C, R>> resolved = new HashMap<>();
    private final Handler<SyntaxNode, C, R> defaultHandler;

    public TreeDispatcher(Handler<SyntaxNode, C, R> defaultHandler) {
        this.defaultHandler = Objects.requireNonNull(defaultHandler, "defaultHandler");
    }

    /**
     * Register a handler for exactly one concrete node type.
     */
    public <N extends SyntaxNode> TreeDispatcher<C, R> register(Class<N> kind, Handler<? super N, C, R> handler) {
        handlers.put(kind, handler);
        resolved.clear();
        return this;
    }

    /**
     * Register a side-effect-only handler; its result is always null.
     */
    public <N extends SyntaxNode> TreeDispatcher<C, R> registerAction(Class<N> kind, BiConsumer<? super N, C> action) {
        return register(kind, (node, context) -> {
            action.accept(node, context);
            return null;
        });
    }

    /**
     * Invoke the handler resolved for the node's concrete type. A null node yields null.
     */
    public R dispatch(SyntaxNode node, C context) {
        if (node == null) {
            return null;
        }
        return resolve(node.getClass()).handle(node, context);
    }

    /**
     * Dispatch every node in order.
     */
    public void dispatchChildren(List<? extends SyntaxNode> nodes, C context) {
        if (nodes == null) {
            return;
        }
        for (SyntaxNode node : nodes) {
            dispatch(node, context);
        }
    }

    boolean isResolved(Class<?> kind) {
        return resolved.containsKey(kind);
    }

    @SuppressWarnings("unchecked")
    private Handler<SyntaxNode, C, R> resolve(Class<?> kind) {
        Handler<SyntaxNode, C, R> handler = resolved.get(kind);
        if (handler == null) {
            Handler<?, C, R> exact = handlers.get(kind);
            handler = exact != null ? (Handler<SyntaxNode, C, R>) exact : defaultHandler;
            resolved.put(kind, handler);
        }
        return handler;
    }
}
