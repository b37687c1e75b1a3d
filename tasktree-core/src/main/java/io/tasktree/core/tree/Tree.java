package io.tasktree.core.tree;

import io.tasktree.core.execution.BlackboardScope;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.logging.Logger;

/// A named, built tree of nodes with exactly one root child.
///
/// A tree is itself a {@link Node}, so it can be embedded with
/// {@link TreeBuilder#subtree(Tree)} or run directly. Topology is frozen once
/// built; the same tree may serve any number of runs, also concurrently.
///
/// {@snippet :
/// Tree<Board> tree = Tree.<Board>builder("Greeter")
///         .sequence()
///             .function(b -> b.name)
///             .writeBlackboard("greeting")
///         .end()
///         .build();
/// Result result = tree.run(new Board("world"));
/// }
///
/// @param <B> blackboard type
/// @see TreeBuilder
public final class Tree<B> extends Node<B> {

    private static final Logger logger = Logger.getLogger(Tree.class.getName());

    Tree(String name) {
        super(NodeKinds.TREE);
        setName(name);
    }

    /// Starts building a tree.
    ///
    /// @param name tree name, the first segment of every full name in it, not null
    /// @param <B> blackboard type
    /// @return a builder positioned at the tree root, never null
    public static <B> TreeBuilder<B> builder(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new TreeBuilder<>(new Tree<>(name));
    }

    @Override
    public int maxChildren() {
        return 1;
    }

    @Override
    public int minChildren() {
        return 1;
    }

    /// @return the single root child, never null
    public Node<B> getRoot() {
        return child(0);
    }

    /// Runs the tree against a blackboard on a fresh context.
    ///
    /// @param blackboard the blackboard, may be null for trees that do not use one
    /// @return the result, never null
    public Result run(B blackboard) {
        return run(blackboard, ExecutionContext.create());
    }

    /// Runs the tree with the blackboard bound to the given context for the
    /// duration of the call. The run's spans hang off the context's trace root,
    /// which is finished with the tree's result when the tree runs at top level.
    ///
    /// @param blackboard the blackboard, may be null
    /// @param context the context, not null
    /// @return the result, never null
    public Result run(B blackboard, ExecutionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        logger.info("Running tree: " + getName());
        try (BlackboardScope scope = context.usingBlackboard(blackboard)) {
            Result result = execute(context);
            if (context.getTracer() == context.getTraceRoot()) {
                context.getTraceRoot().finish(result);
            }
            logger.info("Tree " + getName() + " finished: " + result.getStatus());
            return result;
        }
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return getRoot().execute(context);
    }
}
