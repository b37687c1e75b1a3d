package io.tasktree.core.node.composite;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.CompositeNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.List;

/// Runs children in order and stops at the first success, returning it. If
/// every child fails, returns `FAIL(null)`.
///
/// @param <B> blackboard type
public class SelectorNode<B> extends CompositeNode<B> {

    public SelectorNode() {
        super(NodeKinds.SELECTOR);
    }

    protected SelectorNode(String kind) {
        super(kind);
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        return selectFirstOk(context, getChildren());
    }

    protected final Result selectFirstOk(ExecutionContext context, List<Node<B>> ordered) {
        for (Node<B> child : ordered) {
            Result result = child.execute(context);
            if (result.isOk()) {
                return result;
            }
        }
        return Result.fail();
    }
}
