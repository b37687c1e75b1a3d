package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.logging.Logger;

/// Hands its child to a {@link NodeWrapper}, which runs it and returns the
/// result.
///
/// A wrapper that returns null or raises yields `FAIL(null)`. Cancellation of
/// the child propagates through the wrapper.
///
/// @param <B> blackboard type
public class WrapperNode<B> extends DecoratorNode<B> {

    private static final Logger logger = Logger.getLogger(WrapperNode.class.getName());

    private final NodeWrapper<B> wrapper;

    public WrapperNode(NodeWrapper<B> wrapper) {
        super(NodeKinds.WRAPPER);
        this.wrapper = Objects.requireNonNull(wrapper, "wrapper must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        Result result = wrapper.wrap(() -> primary().execute(context), blackboard(context));
        if (result == null) {
            logger.warning("Wrapper '" + getFullName() + "' returned no result");
            trace.setAttribute("error", "no result");
            return Result.fail();
        }
        return result;
    }
}
