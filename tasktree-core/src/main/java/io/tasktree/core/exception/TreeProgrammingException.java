package io.tasktree.core.exception;

import java.io.Serial;

/// Raised for structural misuse of a tree: bad arity, a misplaced `Else`, a
/// non-positive concurrency limit, or a gather factory whose outputs disagree.
///
/// Unlike runtime failures, this is never converted into a `FAIL` result.
/// Nodes rethrow it unchanged so the defect surfaces to the caller.
public class TreeProgrammingException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4417702965372211908L;

    public TreeProgrammingException(String message) {
        super(message);
    }

    public TreeProgrammingException(String message, Throwable cause) {
        super(message, cause);
    }
}
