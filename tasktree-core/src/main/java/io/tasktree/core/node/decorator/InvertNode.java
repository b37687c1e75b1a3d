package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.result.ResultStatus;
import io.tasktree.core.trace.TraceNode;

/// Flips the child's status and keeps its data.
///
/// @param <B> blackboard type
public class InvertNode<B> extends DecoratorNode<B> {

    public InvertNode() {
        super(NodeKinds.INVERT);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        Result result = primary().execute(context);
        return result.withStatus(result.isOk() ? ResultStatus.FAIL : ResultStatus.OK);
    }
}
