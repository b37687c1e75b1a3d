package io.tasktree.core.function;

/// Zero-argument condition.
@FunctionalInterface
public interface TaskCondition {
    boolean test() throws Exception;
}
