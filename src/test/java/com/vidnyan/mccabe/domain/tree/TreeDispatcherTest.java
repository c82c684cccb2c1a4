package com.vidnyan.mccabe.domain.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeDispatcherTest {

    @Test
    void dispatch_UsesExactKindHandler() {
        TreeDispatcher<List<String>, String> dispatcher = new TreeDispatcher<>((node, seen) -> "default");
        dispatcher.register(IfBranch.class, (node, seen) -> "if " + node.line());

        assertEquals("if 3", dispatcher.dispatch(Trees.ifThen(3, List.of()), new ArrayList<>()));
        assertEquals("default", dispatcher.dispatch(Trees.stmt(4), new ArrayList<>()));
    }

    @Test
    void dispatch_DoesNotMatchSupertypeRegistrations() {
        TreeDispatcher<List<String>, String> dispatcher = new TreeDispatcher<>((node, seen) -> "default");
        dispatcher.register(FunctionDef.class, (node, seen) -> "function");

        assertEquals("default", dispatcher.dispatch(Trees.asyncDef("f", 1), new ArrayList<>()));
    }

    @Test
    void dispatch_NullNodeIsNoOp() {
        TreeDispatcher<List<String>, String> dispatcher = new TreeDispatcher<>((node, seen) -> "default");

        assertNull(dispatcher.dispatch(null, new ArrayList<>()));
    }

    @Test
    void dispatchChildren_PreservesOrder() {
        TreeDispatcher<List<String>, Void> dispatcher = new TreeDispatcher<>((node, seen) -> {
            seen.add("ss " + node.line());
            return null;
        });
        List<String> seen = new ArrayList<>();

        dispatcher.dispatchChildren(List.of(Trees.stmt(1), Trees.stmt(2), Trees.stmt(3)), seen);

        assertEquals(List.of("ss 1", "ss 2", "ss 3"), seen);
    }

    @Test
    void resolution_IsCachedWithoutChangingResults() {
        TreeDispatcher<List<String>, String> dispatcher = new TreeDispatcher<>((node, seen) -> "default");
        dispatcher.register(WhileLoop.class, (node, seen) -> "loop");

        assertFalse(dispatcher.isResolved(WhileLoop.class));
        String first = dispatcher.dispatch(Trees.whileLoop(1, List.of()), new ArrayList<>());
        assertTrue(dispatcher.isResolved(WhileLoop.class));
        String second = dispatcher.dispatch(Trees.whileLoop(2, List.of()), new ArrayList<>());

        assertEquals("loop", first);
        assertEquals(first, second);
    }

    @Test
    void registerAction_ReturnsNull() {
        List<String> seen = new ArrayList<>();
        TreeDispatcher<List<String>, String> dispatcher = new TreeDispatcher<>((node, ctx) -> "default");
        dispatcher.registerAction(ClassDef.class, (node, ctx) -> ctx.add(node.name()));

        assertNull(dispatcher.dispatch(Trees.cls("A", 1), seen));
        assertEquals(List.of("A"), seen);
    }
}
