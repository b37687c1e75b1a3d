package io.tasktree.core.exception;

import java.io.Serial;
import java.util.concurrent.CancellationException;

/// Cooperative cancellation signal unwinding a cancelled task.
///
/// Thrown when a running node observes that its task was cancelled by a
/// `Timeout`, a `Terminable` or an enclosing fan-out. It passes through every
/// node boundary untouched and is absorbed only where the cancelled task was
/// spawned.
///
/// @see io.tasktree.core.execution.SpawnedTask
public class NodeCancelledException extends CancellationException {

    @Serial private static final long serialVersionUID = -2390871462519835416L;

    public NodeCancelledException(String message) {
        super(message);
    }

    /// Creates the signal for an interrupted wait and restores the interrupt flag.
    ///
    /// @param nodeName full name of the node that was waiting, not null
    /// @param cause the interruption, not null
    /// @return the cancellation signal, never null
    public static NodeCancelledException interrupted(String nodeName, InterruptedException cause) {
        Thread.currentThread().interrupt();
        NodeCancelledException e = new NodeCancelledException("Cancelled: " + nodeName);
        e.initCause(cause);
        return e;
    }
}
