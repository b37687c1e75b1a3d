package io.tasktree.core.node.decorator;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Set;

/// Marks the else-branch of an {@link IfNode}. Only legal as an If's second child.
///
/// @param <B> blackboard type
public class ElseNode<B> extends DecoratorNode<B> {

    public ElseNode() {
        super(NodeKinds.ELSE);
    }

    @Override
    protected Set<String> allowedParentKinds() {
        return Set.of(NodeKinds.IF);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return primary().execute(context);
    }
}
