package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardSetter;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// Writes the data of the inbound result onto the blackboard and passes the
/// result through unchanged.
///
/// Without a child the inbound result is the one of the node that finished
/// last on this context (typically the previous sibling in a sequence). With a
/// child, the child runs first and its result is used.
///
/// @param <B> blackboard type
public class WriteBlackboardNode<B> extends Node<B> {

    private final BlackboardSetter<B> setter;

    public WriteBlackboardNode(BlackboardSetter<B> setter) {
        super(NodeKinds.WRITE_BLACKBOARD);
        this.setter = Objects.requireNonNull(setter, "setter must not be null");
    }

    @Override
    public int maxChildren() {
        return 1;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        Result inbound = childCount() > 0 ? child(0).execute(context) : context.getLastResult();
        if (inbound == null) {
            inbound = Result.ok();
        }
        setter.set(blackboard(context), inbound.getData());
        return inbound;
    }
}
