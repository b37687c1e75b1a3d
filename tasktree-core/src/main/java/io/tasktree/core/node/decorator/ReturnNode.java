package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// Keeps the child's status and replaces its data with the factory's, whatever
/// the status.
///
/// @param <B> blackboard type
public class ReturnNode<B> extends DecoratorNode<B> {

    private final BlackboardFunction<B, ?> dataFactory;

    public ReturnNode(BlackboardFunction<B, ?> dataFactory) {
        super(NodeKinds.RETURN);
        this.dataFactory = Objects.requireNonNull(dataFactory, "dataFactory must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        Result result = primary().execute(context);
        return result.withData(dataFactory.apply(blackboard(context)));
    }
}
