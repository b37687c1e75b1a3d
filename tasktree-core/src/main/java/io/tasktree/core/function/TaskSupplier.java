package io.tasktree.core.function;

/// Zero-argument task callable.
///
/// @param <R> produced value
@FunctionalInterface
public interface TaskSupplier<R> {
    R get() throws Exception;
}
