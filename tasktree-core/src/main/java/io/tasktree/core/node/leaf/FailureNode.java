package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;

/// Always `FAIL(null)`.
///
/// @param <B> blackboard type
public class FailureNode<B> extends LeafNode<B> {

    public FailureNode() {
        super(NodeKinds.FAILURE);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return Result.fail();
    }
}
