package io.tasktree.core.function;

import io.tasktree.core.trace.TraceNode;

/// Callable receiving the current blackboard and the trace span of the calling
/// node, for code that records attributes or cost.
///
/// @param <B> blackboard type
/// @param <R> produced value
@FunctionalInterface
public interface TracedFunction<B, R> {
    R apply(B blackboard, TraceNode trace) throws Exception;
}
