package io.tasktree.core.execution;

import io.tasktree.core.exception.NodeCancelledException;
import io.tasktree.core.node.Node;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// A child node invocation running concurrently on the context's executor.
///
/// ### Lifecycle
/// 1. {@link #spawn} submits the invocation; with a semaphore the task waits for
///    a permit before its node starts (admission limit of `Parallel` / `Gather`)
/// 2. the node runs on its own {@link ExecutionContext#fork() forked} context
/// 3. when the body exits, registered {@link SpawnedTaskHooks} fire (if requested)
///    and the task is marked exited
///
/// ### Cancellation
/// {@link #cancelAndAwait()} interrupts the running body and blocks until it
/// has fully exited, so a cancelled task is never observed running after its
/// owner returns. A task cancelled before it started never runs its node.
///
/// @implNote The owner thread is the only caller of `await*` and `cancel*`.
public final class SpawnedTask {

    private static final Logger logger = Logger.getLogger(SpawnedTask.class.getName());

    private static final int NEW = 0;
    private static final int RUNNING = 1;
    private static final int SKIPPED = 2;

    private final Node<?> node;
    private final ExecutionContext context;
    private final Semaphore permits;
    private final boolean notifyHooks;
    private final AtomicInteger state = new AtomicInteger(NEW);
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile Future<Result> future;
    private volatile TraceNode trace;

    private SpawnedTask(
            Node<?> node, ExecutionContext context, Semaphore permits, boolean notifyHooks) {
        this.node = node;
        this.context = context;
        this.permits = permits;
        this.notifyHooks = notifyHooks;
    }

    /// Starts a child invocation.
    ///
    /// @param node the node to run, not null
    /// @param context the forked context the node runs on, not null
    /// @param permits admission semaphore, may be null for unbounded
    /// @param notifyHooks whether to fire the spawned-task hooks when the task finishes
    /// @return the running task, never null
    public static SpawnedTask spawn(
            Node<?> node, ExecutionContext context, Semaphore permits, boolean notifyHooks) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(context, "context must not be null");
        SpawnedTask task = new SpawnedTask(node, context, permits, notifyHooks);
        task.future = context.getExecutorService().submit(task::run);
        return task;
    }

    private Result run() throws InterruptedException {
        if (!state.compareAndSet(NEW, RUNNING)) {
            return Result.fail();
        }
        Result result = null;
        boolean acquired = false;
        try {
            if (permits != null) {
                permits.acquire();
                acquired = true;
            }
            trace = node.openTrace(context);
            result = node.execute(context, trace);
            return result;
        } finally {
            if (acquired) {
                permits.release();
            }
            if (notifyHooks) {
                SpawnedTaskHooks.fire(context, trace, result != null ? result : Result.fail());
            }
            exited.countDown();
        }
    }

    /// Waits for the task's result.
    ///
    /// @return the node's result, never null
    /// @throws InterruptedException if the waiting thread is interrupted
    /// @throws NodeCancelledException if the task was cancelled
    public Result await() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw cancelled();
        }
    }

    /// Waits at most `timeout` for the task's result.
    ///
    /// @param timeout maximum wait, not null
    /// @return the node's result, never null
    /// @throws InterruptedException if the waiting thread is interrupted
    /// @throws TimeoutException if the task has not finished in time
    public Result await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (CancellationException e) {
            throw cancelled();
        }
    }

    public boolean isDone() {
        return future.isDone();
    }

    /// Returns the span opened for this task's node.
    ///
    /// @return the span, or null if the node has not started
    public TraceNode getTrace() {
        return trace;
    }

    /// Cancels the task and blocks until its body has exited.
    ///
    /// @implNote The wait ignores interrupts of the calling thread (restoring
    /// the flag afterwards): an owner being cancelled itself must still not
    /// return while its child is running.
    public void cancelAndAwait() {
        cancel();
        awaitExit();
    }

    private void cancel() {
        context.cancel();
        if (state.compareAndSet(NEW, SKIPPED)) {
            future.cancel(false);
            if (notifyHooks) {
                SpawnedTaskHooks.fire(context, null, Result.fail());
            }
            exited.countDown();
            return;
        }
        future.cancel(true);
    }

    private void awaitExit() {
        boolean interrupted = false;
        while (true) {
            try {
                exited.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.fine("Spawned task exited: " + node.getFullName());
    }

    /// Waits for every task, in order. Failures of individual tasks never cut the
    /// wait short; a programming error raised by any task is rethrown once all
    /// have finished.
    ///
    /// @param tasks tasks to wait for, not null
    /// @param owner full name of the waiting node, for diagnostics
    /// @return results positioned like `tasks`, never null
    /// @throws NodeCancelledException if the waiting thread is interrupted; all
    ///         tasks are cancelled and awaited first
    public static List<Result> awaitAll(List<SpawnedTask> tasks, String owner) {
        List<Result> results = new ArrayList<>(tasks.size());
        RuntimeException failure = null;
        for (SpawnedTask task : tasks) {
            try {
                results.add(task.await());
            } catch (InterruptedException e) {
                cancelAll(tasks);
                throw NodeCancelledException.interrupted(owner, e);
            } catch (NodeCancelledException e) {
                results.add(Result.fail());
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                }
                results.add(Result.fail());
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    /// Cancels and awaits every task.
    ///
    /// @param tasks tasks to cancel, not null
    public static void cancelAll(List<SpawnedTask> tasks) {
        for (SpawnedTask task : tasks) {
            task.cancel();
        }
        for (SpawnedTask task : tasks) {
            task.awaitExit();
        }
    }

    private RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof InterruptedException) {
            return cancelled();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Spawned task failed: " + node.getFullName(), cause);
    }

    private NodeCancelledException cancelled() {
        return new NodeCancelledException("Cancelled: " + node.getFullName());
    }
}
