package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.BlackboardScope;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.tree.Tree;
import java.util.Objects;

/// Embeds a separately built tree.
///
/// With a factory, the tree runs against the blackboard the factory derives
/// from the parent's, bound for the duration of the call; without one it runs
/// against the parent's blackboard itself.
///
/// @param <B> blackboard type of the enclosing tree
/// @param <C> blackboard type of the embedded tree
public class SubtreeNode<B, C> extends LeafNode<B> {

    private final Tree<C> tree;
    private final BlackboardFunction<B, C> factory;

    /// @param tree the embedded tree, not null
    /// @param factory derives the embedded tree's blackboard, or null to share the parent's
    public SubtreeNode(Tree<C> tree, BlackboardFunction<B, C> factory) {
        super(NodeKinds.SUBTREE);
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.factory = factory;
    }

    public Tree<C> getTree() {
        return tree;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        if (factory == null) {
            return tree.execute(context);
        }
        C derived = factory.apply(blackboard(context));
        try (BlackboardScope scope = context.usingBlackboard(derived)) {
            return tree.execute(context);
        }
    }
}
