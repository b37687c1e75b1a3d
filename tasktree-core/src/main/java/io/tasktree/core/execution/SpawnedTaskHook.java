package io.tasktree.core.execution;

import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;

/// Callback invoked once for every child task spawned by `Parallel`, `Gather`
/// or `Terminable`, after the task has finished.
///
/// @see SpawnedTaskHooks
@FunctionalInterface
public interface SpawnedTaskHook {

    /// Called on the thread that ran the task.
    ///
    /// @param context the forked context the task ran on, not null
    /// @param trace span of the task's node, null if the task was cancelled before it started
    /// @param result final result of the task, `FAIL(null)` if it was cancelled, never null
    void onFinished(ExecutionContext context, TraceNode trace, Result result);
}
