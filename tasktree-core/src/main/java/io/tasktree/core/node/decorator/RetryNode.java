package io.tasktree.core.node.decorator;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Re-runs a failing child up to `maxTries` times.
///
/// Between attempt `n` and `n + 1` the node sleeps for `sleeps[n - 1]`; once
/// the schedule is exhausted its last entry applies to every further gap. An
/// empty schedule retries immediately. Returns the first success, or
/// `FAIL(null)` when every try failed.
///
/// @param <B> blackboard type
public class RetryNode<B> extends DecoratorNode<B> {

    private static final Logger logger = Logger.getLogger(RetryNode.class.getName());

    private final int maxTries;
    private final List<Duration> sleeps;

    public RetryNode(int maxTries, List<Duration> sleeps) {
        super(NodeKinds.RETRY);
        if (maxTries <= 0) {
            throw new TreeProgrammingException("Retry max tries must be positive, got " + maxTries);
        }
        for (Duration sleep : sleeps) {
            if (sleep == null || sleep.isNegative()) {
                throw new TreeProgrammingException("Retry sleep must not be negative: " + sleep);
            }
        }
        this.maxTries = maxTries;
        this.sleeps = List.copyOf(sleeps);
    }

    /// Pause before the attempt following attempt `attempt` (1-based).
    ///
    /// @param attempt number of the attempt that just failed
    /// @return the pause, never null
    Duration sleepAfter(int attempt) {
        if (sleeps.isEmpty()) {
            return Duration.ZERO;
        }
        return sleeps.get(Math.min(attempt - 1, sleeps.size() - 1));
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace)
            throws InterruptedException {
        for (int attempt = 1; attempt <= maxTries; attempt++) {
            trace.setAttribute("tries", attempt);
            Result result = primary().execute(context);
            if (result.isOk()) {
                return result;
            }
            if (attempt < maxTries) {
                Duration pause = sleepAfter(attempt);
                logger.fine(
                        "Retrying " + getFullName() + " after attempt " + attempt + " in " + pause);
                if (!pause.isZero()) {
                    TimeUnit.MILLISECONDS.sleep(pause.toMillis());
                }
            }
        }
        logger.info("Giving up on " + getFullName() + " after " + maxTries + " tries");
        return Result.fail();
    }
}
