package io.tasktree.core.node.decorator;

import io.tasktree.core.exception.NodeCancelledException;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTask;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs its primary child under a time budget.
///
/// On time, the child's result passes through. On expiry the child's task is
/// cancelled and awaited; then the optional second child (usually a
/// {@link FallbackNode}) runs and its result is returned, or `FAIL(null)`
/// without one.
///
/// @param <B> blackboard type
public class TimeoutNode<B> extends DecoratorNode<B> {

    private static final Logger logger = Logger.getLogger(TimeoutNode.class.getName());

    private final Duration timeout;

    public TimeoutNode(Duration timeout) {
        super(NodeKinds.TIMEOUT);
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new TreeProgrammingException("Timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
    }

    @Override
    public int maxChildren() {
        return 2;
    }

    @Override
    protected void checkChild(Node<B> child, int position) {
        super.checkChild(child, position);
        if (position == 0 && child instanceof FallbackNode) {
            throw new TreeProgrammingException(
                    "Fallback must follow the primary child of Timeout '" + getName() + "'");
        }
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        SpawnedTask task = SpawnedTask.spawn(primary(), context.fork(), null, false);
        try {
            Result result = task.await(timeout);
            trace.setAttribute("timed_out", false);
            return result;
        } catch (TimeoutException e) {
            task.cancelAndAwait();
            trace.setAttribute("timed_out", true);
            logger.info("Timed out after " + timeout.toMillis() + "ms: " + getFullName());
        } catch (InterruptedException e) {
            task.cancelAndAwait();
            throw NodeCancelledException.interrupted(getFullName(), e);
        }
        if (childCount() > 1) {
            return child(1).execute(context);
        }
        return Result.fail();
    }
}
