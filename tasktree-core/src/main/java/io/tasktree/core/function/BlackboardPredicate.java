package io.tasktree.core.function;

/// Condition evaluated against the current blackboard.
///
/// @param <B> blackboard type
@FunctionalInterface
public interface BlackboardPredicate<B> {
    boolean test(B blackboard) throws Exception;
}
