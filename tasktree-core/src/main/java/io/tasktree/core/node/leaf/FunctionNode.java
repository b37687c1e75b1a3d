package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.TracedFunction;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.node.ReturnValues;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// Invokes a caller function against the blackboard.
///
/// The function is normalized to a {@link TracedFunction} when attached (see
/// {@link io.tasktree.core.function.Functions}); its return value is converted by
/// {@link ReturnValues}. Any exception yields `FAIL(null)`.
///
/// @param <B> blackboard type
public class FunctionNode<B> extends LeafNode<B> {

    private final TracedFunction<B, ?> function;

    public FunctionNode(TracedFunction<B, ?> function) {
        super(NodeKinds.FUNCTION);
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        return ReturnValues.toResult(function.apply(blackboard(context), trace));
    }
}
