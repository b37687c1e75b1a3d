package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardPredicate;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// `OK(true)` if the predicate holds, `FAIL(null)` if it does not or raises.
///
/// @param <B> blackboard type
public class AssertNode<B> extends LeafNode<B> {

    private final BlackboardPredicate<B> predicate;

    public AssertNode(BlackboardPredicate<B> predicate) {
        super(NodeKinds.ASSERT);
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        return predicate.test(blackboard(context)) ? Result.ok(Boolean.TRUE) : Result.fail();
    }
}
