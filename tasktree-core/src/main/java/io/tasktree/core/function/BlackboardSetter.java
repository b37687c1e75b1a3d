package io.tasktree.core.function;

/// Writes a value onto the blackboard.
///
/// @param <B> blackboard type
@FunctionalInterface
public interface BlackboardSetter<B> {
    void set(B blackboard, Object value) throws Exception;
}
