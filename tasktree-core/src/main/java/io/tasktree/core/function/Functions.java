package io.tasktree.core.function;

import io.tasktree.core.execution.Blackboards;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/// Normalizes the accepted call shapes to a single form when a node is attached,
/// so invocation never has to inspect arity.
public final class Functions {

    private Functions() {}

    public static <B, R> TracedFunction<B, R> traced(TaskSupplier<R> supplier) {
        Objects.requireNonNull(supplier, "function must not be null");
        return (blackboard, trace) -> supplier.get();
    }

    public static <B, R> TracedFunction<B, R> traced(BlackboardFunction<B, R> function) {
        Objects.requireNonNull(function, "function must not be null");
        return (blackboard, trace) -> function.apply(blackboard);
    }

    public static <B> BlackboardPredicate<B> predicate(TaskCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        return blackboard -> condition.test();
    }

    /// Condition reading an attribute and testing it with {@link #isTruthy(Object)}.
    ///
    /// @param attribute attribute name, not null
    /// @param <B> blackboard type
    /// @return the predicate, never null
    public static <B> BlackboardPredicate<B> predicate(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return blackboard -> isTruthy(Blackboards.read(blackboard, attribute));
    }

    /// Truthiness of a blackboard value:
    /// - `null` is false
    /// - a `Boolean` is its own value
    /// - a number is true unless zero
    /// - strings, collections, maps and arrays are true unless empty
    /// - anything else is true
    ///
    /// @param value the value, may be null
    /// @return whether the value counts as true
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    public static <B> BlackboardFunction<B, Object> getter(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return blackboard -> Blackboards.read(blackboard, attribute);
    }

    public static <B> BlackboardSetter<B> setter(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return (blackboard, value) -> Blackboards.write(blackboard, attribute, value);
    }
}
