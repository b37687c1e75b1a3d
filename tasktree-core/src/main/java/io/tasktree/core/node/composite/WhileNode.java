package io.tasktree.core.node.composite;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardPredicate;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// Runs its child while a condition holds.
///
/// ### Termination
/// - condition false: the last successful child result, or `FAIL(null)` if the
///   body never ran
/// - child fails: stops at once and returns the last successful result (or
///   `FAIL(null)` if none), not the failing one
/// - `maxLoopTimes` reached: as if the condition had become false
///
/// @param <B> blackboard type
public class WhileNode<B> extends DecoratorNode<B> {

    private final BlackboardPredicate<B> condition;
    private final Integer maxLoopTimes;

    /// @param condition loop condition, not null
    /// @param maxLoopTimes iteration cap, or null for none
    public WhileNode(BlackboardPredicate<B> condition, Integer maxLoopTimes) {
        super(NodeKinds.WHILE);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        if (maxLoopTimes != null && maxLoopTimes < 0) {
            throw new TreeProgrammingException("While max loop times must not be negative");
        }
        this.maxLoopTimes = maxLoopTimes;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        Result lastOk = null;
        int loops = 0;
        try {
            while ((maxLoopTimes == null || loops < maxLoopTimes)
                    && condition.test(blackboard(context))) {
                loops++;
                Result result = primary().execute(context);
                if (result.isFail()) {
                    break;
                }
                lastOk = result;
            }
        } finally {
            trace.setAttribute("loops", loops);
        }
        return lastOk != null ? lastOk : Result.fail();
    }
}
