package io.tasktree.core.function;

/// Callable receiving the current blackboard.
///
/// @param <B> blackboard type
/// @param <R> produced value
@FunctionalInterface
public interface BlackboardFunction<B, R> {
    R apply(B blackboard) throws Exception;
}
