package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.result.Result;
import io.tasktree.core.result.ResultStatus;
import io.tasktree.core.trace.TraceNode;

/// Runs the child and returns a fixed status. The data is the child's, or the
/// factory's when one is given.
///
/// @param <B> blackboard type
abstract class ForceStatusNode<B> extends DecoratorNode<B> {

    private final ResultStatus status;
    private final BlackboardFunction<B, ?> dataFactory;

    ForceStatusNode(String kind, ResultStatus status, BlackboardFunction<B, ?> dataFactory) {
        super(kind);
        this.status = status;
        this.dataFactory = dataFactory;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        Result result = primary().execute(context);
        Object data = dataFactory != null ? dataFactory.apply(blackboard(context)) : result.getData();
        return Result.of(status, data);
    }
}
