package io.tasktree.core.node.decorator;

import io.tasktree.core.result.Result;
import java.util.concurrent.Callable;

/// Code that runs around a {@link WrapperNode}'s child.
///
/// The wrapper decides when, and how often, the child runs by calling
/// `child`; whatever it returns becomes the wrapper node's result. Setup and
/// teardown go around the call, typically in a `try`/`finally`:
/// {@snippet :
/// builder.wrapper((child, board) -> {
///     lock.lock();
///     try {
///         return child.call();
///     } finally {
///         lock.unlock();
///     }
/// });
/// }
///
/// @param <B> blackboard type
@FunctionalInterface
public interface NodeWrapper<B> {

    /// @param child runs the wrapped child once per call and returns its result
    /// @param blackboard the current blackboard
    /// @return the wrapper node's result; null is treated as a failure
    /// @throws Exception to fail the wrapper node
    Result wrap(Callable<Result> child, B blackboard) throws Exception;
}
