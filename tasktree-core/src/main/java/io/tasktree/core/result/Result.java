package io.tasktree.core.result;

import java.util.Objects;

/// Immutable outcome of a node invocation: a status plus an opaque payload.
///
/// Status and data are independent. A `FAIL` may carry data (for example the
/// malformed text a parser gave up on) and an `OK` may carry none.
///
/// ### Factory Methods
/// - {@link #ok()} / {@link #ok(Object)} for success
/// - {@link #fail()} / {@link #fail(Object)} for failure
/// - {@link #of(ResultStatus, Object)} when the status is computed
///
/// @implNote Results are created per invocation and never mutated. The payload
/// itself is not copied, so a mutable payload stays the caller's concern.
///
/// @see ResultStatus
public final class Result {

    private static final Result OK_EMPTY = new Result(ResultStatus.OK, null);
    private static final Result FAIL_EMPTY = new Result(ResultStatus.FAIL, null);

    private final ResultStatus status;
    private final Object data;

    private Result(ResultStatus status, Object data) {
        this.status = status;
        this.data = data;
    }

    /// Returns an `OK` result without data.
    ///
    /// @return the shared empty success, never null
    public static Result ok() {
        return OK_EMPTY;
    }

    /// Returns an `OK` result carrying the given payload.
    ///
    /// @param data the payload, may be null
    /// @return a success result, never null
    public static Result ok(Object data) {
        return data == null ? OK_EMPTY : new Result(ResultStatus.OK, data);
    }

    /// Returns a `FAIL` result without data.
    ///
    /// @return the shared empty failure, never null
    public static Result fail() {
        return FAIL_EMPTY;
    }

    /// Returns a `FAIL` result carrying the given payload.
    ///
    /// @param data the payload, may be null
    /// @return a failure result, never null
    public static Result fail(Object data) {
        return data == null ? FAIL_EMPTY : new Result(ResultStatus.FAIL, data);
    }

    /// Returns a result with the given status and payload.
    ///
    /// @param status the status, not null
    /// @param data the payload, may be null
    /// @return a result, never null
    public static Result of(ResultStatus status, Object data) {
        Objects.requireNonNull(status, "status must not be null");
        return status == ResultStatus.OK ? ok(data) : fail(data);
    }

    public ResultStatus getStatus() {
        return status;
    }

    public Object getData() {
        return data;
    }

    /// Returns the payload cast to the requested type.
    ///
    /// @param type expected payload type, not null
    /// @param <T> payload type
    /// @return the payload, may be null
    /// @throws ClassCastException if the payload is not of the requested type
    public <T> T getDataAs(Class<T> type) {
        return type.cast(data);
    }

    public boolean isOk() {
        return status == ResultStatus.OK;
    }

    public boolean isFail() {
        return status == ResultStatus.FAIL;
    }

    /// Returns a result with the same status and a different payload.
    ///
    /// @param newData replacement payload, may be null
    /// @return a new result, never null
    public Result withData(Object newData) {
        return of(status, newData);
    }

    /// Returns a result with the same payload and a different status.
    ///
    /// @param newStatus replacement status, not null
    /// @return a new result, never null
    public Result withStatus(ResultStatus newStatus) {
        return of(newStatus, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result other)) {
            return false;
        }
        return status == other.status && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, data);
    }

    @Override
    public String toString() {
        return status + "(" + data + ")";
    }
}
