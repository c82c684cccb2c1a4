package com.vidnyan.mccabe.domain.cfg;

import com.vidnyan.mccabe.domain.graph.PathGraph;
import com.vidnyan.mccabe.domain.graph.PathNode;
import com.vidnyan.mccabe.domain.tree.AsyncForLoop;
import com.vidnyan.mccabe.domain.tree.AsyncFunctionDef;
import com.vidnyan.mccabe.domain.tree.BranchingConstruct;
import com.vidnyan.mccabe.domain.tree.ClassDef;
import com.vidnyan.mccabe.domain.tree.ForLoop;
import com.vidnyan.mccabe.domain.tree.FunctionDef;
import com.vidnyan.mccabe.domain.tree.FunctionScope;
import com.vidnyan.mccabe.domain.tree.IfBranch;
import com.vidnyan.mccabe.domain.tree.Statement;
import com.vidnyan.mccabe.domain.tree.SyntaxNode;
import com.vidnyan.mccabe.domain.tree.TreeDispatcher;
import com.vidnyan.mccabe.domain.tree.WhileLoop;
import com.vidnyan.mccabe.domain.tree.WithBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one control-flow graph per function and per top-level control-flow region.
 * <p>
 * Rules:
 * <ul>
 *   <li>a simple statement is one node appended after the current tail;</li>
 *   <li>a loop or conditional is a decision node whose body and else-body start from it
 *       and reconverge in a join node; without an else-body the decision node itself
 *       is also a loose end;</li>
 *   <li>a function nested in an open graph is inlined: entry node, body, then a join
 *       reached from both the body and the entry;</li>
 *   <li>statements outside any function or region attach to nothing.</li>
 * </ul>
 * Instances hold no traversal state and may be shared; every {@link #build} call works
 * on its own {@link TraversalContext}.
 */
@Slf4j
public class PathGraphingVisitor {

    static final String LOOP_LABEL = "loop";
    static final String IF_LABEL = "if";
    static final String WITH_LABEL = "with";
    static final String STATEMENT_LABEL = "ss";

    /**
     * Traverse {@code root} and return the sealed graphs keyed by qualified name,
     * in sealing order.
     */
    public Map<String, PathGraph> build(SyntaxNode root) {
        TraversalContext context = new TraversalContext();
        new Walk().dispatcher.dispatch(root, context);
        return context.completedGraphs();
    }

    /**
     * Sealed graphs of {@code root} in sealing order.
     */
    public List<PathGraph> graphs(SyntaxNode root) {
        return List.copyOf(build(root).values());
    }

    /**
     * One traversal: a dispatcher whose resolution cache lives as long as the walk.
     */
    private static final class Walk {

        private final TreeDispatcher<TraversalContext, Void> dispatcher = new TreeDispatcher<>(this::visitDefault);

        Walk() {
            dispatcher.registerAction(FunctionDef.class, this::visitFunction)
                    .registerAction(AsyncFunctionDef.class, this::visitFunction)
                    .registerAction(ClassDef.class, this::visitClass)
                    .registerAction(ForLoop.class, this::visitLoop)
                    .registerAction(AsyncForLoop.class, this::visitLoop)
                    .registerAction(WhileLoop.class, this::visitLoop)
                    .registerAction(IfBranch.class, this::visitIf)
                    .registerAction(WithBlock.class, this::visitWith);
        }

        private Void visitDefault(SyntaxNode node, TraversalContext context) {
            if (node instanceof Statement) {
                visitSimpleStatement(node, context);
            } else {
                dispatcher.dispatchChildren(node.children(), context);
            }
            return null;
        }

        private void visitSimpleStatement(SyntaxNode node, TraversalContext context) {
            context.append(PathNode.statement(STATEMENT_LABEL + " " + node.lineOrZero()));
        }

        private void visitFunction(FunctionScope node, TraversalContext context) {
            if (node.name() == null || node.name().isBlank()) {
                log.debug("Skipping unnamed function at line {}", node.lineOrZero());
                return;
            }
            String prefix = context.qualifiedPrefix();
            String entity = prefix.isEmpty()
                    ? node.name()
                    : prefix.substring(0, prefix.length() - 1) + ", " + node.name();
            String name = node.lineOrZero() + ", " + node.column() + ", " + entity;

            if (context.isGraphOpen()) {
                // closure: one statement of the enclosing flow that may or may not run its body
                PathNode entry = context.append(PathNode.decision(name));
                dispatcher.dispatchChildren(node.body(), context);
                context.joinAt(List.of(context.currentTail(), entry));
            } else {
                PathGraph graph = new PathGraph(name, entity, node.lineOrZero(), node.column());
                context.open(graph, PathNode.statement(name));
                dispatcher.dispatchChildren(node.body(), context);
                context.sealAndRegister(prefix + node.name());
            }
        }

        private void visitClass(ClassDef node, TraversalContext context) {
            if (node.name() == null || node.name().isBlank()) {
                log.debug("Skipping unnamed class at line {}", node.lineOrZero());
                return;
            }
            String previous = context.enterClass(node.name());
            try {
                dispatcher.dispatchChildren(node.body(), context);
            } finally {
                context.restorePrefix(previous);
            }
        }

        private void visitLoop(BranchingConstruct node, TraversalContext context) {
            subgraph(node, LOOP_LABEL + " " + node.lineOrZero(), context);
        }

        private void visitIf(IfBranch node, TraversalContext context) {
            subgraph(node, IF_LABEL + " " + node.lineOrZero(), context);
        }

        private void visitWith(WithBlock node, TraversalContext context) {
            context.append(PathNode.statement(WITH_LABEL + " " + node.lineOrZero()));
            dispatcher.dispatchChildren(node.body(), context);
        }

        private void subgraph(BranchingConstruct node, String label, TraversalContext context) {
            if (context.isGraphOpen()) {
                PathNode decision = context.append(PathNode.decision(label));
                branches(node, decision, context);
            } else {
                // orphan region at module or class level
                PathGraph graph = new PathGraph(label, label, node.lineOrZero(), node.column());
                PathNode decision = PathNode.decision(label);
                context.open(graph, decision);
                branches(node, decision, context);
                context.sealAndRegister(context.qualifiedPrefix() + label);
            }
        }

        private void branches(BranchingConstruct node, PathNode decision, TraversalContext context) {
            List<PathNode> looseEnds = new ArrayList<>();
            context.moveTail(decision);
            dispatcher.dispatchChildren(node.body(), context);
            looseEnds.add(context.currentTail());

            if (node.orelse().isEmpty()) {
                looseEnds.add(decision);
            } else {
                context.moveTail(decision);
                dispatcher.dispatchChildren(node.orelse(), context);
                looseEnds.add(context.currentTail());
            }
            context.joinAt(looseEnds);
        }
    }
}
