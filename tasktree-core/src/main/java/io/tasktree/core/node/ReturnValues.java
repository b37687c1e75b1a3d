package io.tasktree.core.node;

import io.tasktree.core.result.Result;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/// Turns what a caller function returned into a {@link Result}.
///
/// - a `Result` passes through unchanged
/// - a `CompletionStage` or `Future` is awaited and its value converted in turn
/// - anything else becomes `OK(value)`
public final class ReturnValues {

    private ReturnValues() {}

    /// Converts a returned value.
    ///
    /// @param value returned value, may be null
    /// @return the result, never null
    /// @throws InterruptedException if interrupted while awaiting an asynchronous value
    /// @throws Exception the failure of an asynchronous value
    public static Result toResult(Object value) throws Exception {
        Object resolved = await(value);
        if (resolved instanceof Result result) {
            return result;
        }
        return Result.ok(resolved);
    }

    /// Awaits asynchronous values, returning plain values unchanged.
    ///
    /// @param value returned value, may be null
    /// @return the resolved value, may be null
    /// @throws Exception the failure of an asynchronous value
    public static Object await(Object value) throws Exception {
        Object current = value;
        while (true) {
            Future<?> future;
            if (current instanceof CompletionStage<?> stage) {
                future = stage.toCompletableFuture();
            } else if (current instanceof Future<?> plain) {
                future = plain;
            } else {
                return current;
            }
            try {
                current = future.get();
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        }
    }
}
