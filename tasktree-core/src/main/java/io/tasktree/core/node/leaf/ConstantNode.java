package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;

/// Always `OK(value)`.
///
/// @param <B> blackboard type
public class ConstantNode<B> extends LeafNode<B> {

    private final Object value;

    public ConstantNode(Object value) {
        super(NodeKinds.CONSTANT);
        this.value = value;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return Result.ok(value);
    }
}
