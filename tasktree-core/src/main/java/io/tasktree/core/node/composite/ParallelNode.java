package io.tasktree.core.node.composite;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTask;
import io.tasktree.core.node.CompositeNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.logging.Logger;

/// Runs every child as a concurrently spawned task and waits for all of them.
///
/// A failing child never cancels its siblings. The result is `OK` only if all
/// children succeed; its data lists the children's data in child order, with
/// `null` at failed positions. At most `concurrencyLimit` children run at once.
///
/// @implNote Children share the parent's blackboard object. Making it safe for
/// concurrent mutation is the caller's concern.
///
/// @param <B> blackboard type
public class ParallelNode<B> extends CompositeNode<B> {

    private static final Logger logger = Logger.getLogger(ParallelNode.class.getName());

    private final Integer concurrencyLimit;

    /// @param concurrencyLimit maximum number of concurrently running children,
    ///        or null for no limit beyond the child count
    public ParallelNode(Integer concurrencyLimit) {
        super(NodeKinds.PARALLEL);
        if (concurrencyLimit != null && concurrencyLimit <= 0) {
            throw new TreeProgrammingException(
                    "Parallel concurrency limit must be positive, got " + concurrencyLimit);
        }
        this.concurrencyLimit = concurrencyLimit;
    }

    public Integer getConcurrencyLimit() {
        return concurrencyLimit;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        logger.fine(
                "Executing parallel node: " + getFullName() + " with " + childCount() + " children");
        Semaphore permits = concurrencyLimit == null ? null : new Semaphore(concurrencyLimit);
        List<SpawnedTask> tasks = new ArrayList<>(childCount());
        try {
            for (Node<B> child : getChildren()) {
                tasks.add(SpawnedTask.spawn(child, context.fork(), permits, true));
            }
        } catch (RuntimeException e) {
            SpawnedTask.cancelAll(tasks);
            throw e;
        }
        return FanOut.aggregate(SpawnedTask.awaitAll(tasks, getFullName()));
    }
}
