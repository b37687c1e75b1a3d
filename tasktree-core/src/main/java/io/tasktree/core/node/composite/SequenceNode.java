package io.tasktree.core.node.composite;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.CompositeNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;

/// Runs children in order and stops at the first failure, returning it
/// unchanged. If every child succeeds, returns the last child's result.
///
/// @param <B> blackboard type
public class SequenceNode<B> extends CompositeNode<B> {

    public SequenceNode() {
        super(NodeKinds.SEQUENCE);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        Result last = Result.ok();
        for (Node<B> child : getChildren()) {
            last = child.execute(context);
            if (last.isFail()) {
                return last;
            }
        }
        return last;
    }
}
