package io.tasktree.core.result;

/// Outcome of a single node invocation.
///
/// @see Result
public enum ResultStatus {

    /// The node succeeded.
    OK,

    /// The node failed. A failure may still carry data.
    FAIL
}
