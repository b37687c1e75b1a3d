package io.tasktree.core.node.composite;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTask;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.logging.Logger;

/// Like {@link ParallelNode}, but the subtrees and the blackboards they run
/// against are produced by a factory each time the node runs.
///
/// Each (subtree, blackboard) pair runs as its own spawned task on a context
/// bound to that blackboard. A factory returning lists of different lengths is
/// a programming error and is raised, not turned into `FAIL`.
///
/// @param <B> blackboard type of the enclosing tree
/// @param <C> blackboard type of the gathered subtrees
public class GatherNode<B, C> extends Node<B> {

    private static final Logger logger = Logger.getLogger(GatherNode.class.getName());

    private final BlackboardFunction<B, GatherPlan<C>> factory;
    private final Integer concurrencyLimit;

    public GatherNode(BlackboardFunction<B, GatherPlan<C>> factory, Integer concurrencyLimit) {
        super(NodeKinds.GATHER);
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        if (concurrencyLimit != null && concurrencyLimit <= 0) {
            throw new TreeProgrammingException(
                    "Gather concurrency limit must be positive, got " + concurrencyLimit);
        }
        this.concurrencyLimit = concurrencyLimit;
    }

    /// Gathered subtrees are produced at run time, never attached while building.
    @Override
    public int maxChildren() {
        return 0;
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        GatherPlan<C> plan = factory.apply(blackboard(context));
        if (plan == null) {
            throw new TreeProgrammingException("Gather '" + getFullName() + "' factory returned null");
        }
        if (plan.trees().size() != plan.blackboards().size()) {
            throw new TreeProgrammingException(
                    "Gather '"
                            + getFullName()
                            + "' factory returned "
                            + plan.trees().size()
                            + " trees but "
                            + plan.blackboards().size()
                            + " blackboards");
        }
        logger.fine("Gathering " + plan.trees().size() + " subtrees at " + getFullName());
        trace.setAttribute("tasks", plan.trees().size());
        Semaphore permits = concurrencyLimit == null ? null : new Semaphore(concurrencyLimit);
        List<SpawnedTask> tasks = new ArrayList<>(plan.trees().size());
        try {
            for (int i = 0; i < plan.trees().size(); i++) {
                Node<C> tree = plan.trees().get(i);
                if (!tree.isSealed()) {
                    tree.seal(getFullName());
                }
                ExecutionContext forked = context.fork(plan.blackboards().get(i));
                tasks.add(SpawnedTask.spawn(tree, forked, permits, true));
            }
        } catch (RuntimeException e) {
            SpawnedTask.cancelAll(tasks);
            throw e;
        }
        return FanOut.aggregate(SpawnedTask.awaitAll(tasks, getFullName()));
    }
}
