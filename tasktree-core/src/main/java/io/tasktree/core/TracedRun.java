package io.tasktree.core;

import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;

/// Outcome of {@link TaskTreeEnvironment#run(io.tasktree.core.tree.Tree, Object)}.
///
/// @param result the tree's result, never null
/// @param trace the run's trace root, never null
/// @param traceId id under which the trace was saved, never null
public record TracedRun(Result result, TraceNode trace, String traceId) {}
