package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Set;

/// Marks the branch a {@link TerminableNode} runs after termination or a
/// {@link TimeoutNode} runs after expiry. Only legal as their second child.
///
/// @param <B> blackboard type
public class FallbackNode<B> extends DecoratorNode<B> {

    public FallbackNode() {
        super(NodeKinds.FALLBACK);
    }

    @Override
    protected Set<String> allowedParentKinds() {
        return Set.of(NodeKinds.TERMINABLE, NodeKinds.TIMEOUT);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return primary().execute(context);
    }
}
