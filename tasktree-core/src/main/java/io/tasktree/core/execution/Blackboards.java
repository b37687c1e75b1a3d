package io.tasktree.core.execution;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;

/// Reads and writes blackboard attributes by name.
///
/// ### Resolution order
/// - `Map` blackboards: the entry under the attribute name
/// - read: getter `getX()` / `isX()`, record-style accessor `x()`, then field `x`
/// - write: setter `setX(value)`, then non-final field `x`
///
/// Fields are searched up the class hierarchy and may be private.
public final class Blackboards {

    private Blackboards() {}

    /// Reads an attribute.
    ///
    /// @param blackboard the blackboard, not null
    /// @param attribute attribute name, not null
    /// @return the value, may be null
    /// @throws IllegalArgumentException if the blackboard has no such attribute
    @SuppressWarnings("unchecked")
    public static Object read(Object blackboard, String attribute) {
        Objects.requireNonNull(blackboard, "blackboard must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (blackboard instanceof Map<?, ?> map) {
            return ((Map<String, Object>) map).get(attribute);
        }
        Class<?> type = blackboard.getClass();
        String capitalized = capitalize(attribute);
        for (String candidate : new String[] {"get" + capitalized, "is" + capitalized, attribute}) {
            Method method = findMethod(type, candidate, 0);
            if (method != null) {
                return invoke(method, blackboard);
            }
        }
        Field field = findField(type, attribute);
        if (field == null) {
            throw new IllegalArgumentException(
                    "No readable attribute '" + attribute + "' on " + type.getName());
        }
        try {
            field.setAccessible(true);
            return field.get(blackboard);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot read attribute '" + attribute + "'", e);
        }
    }

    /// Writes an attribute.
    ///
    /// @param blackboard the blackboard, not null
    /// @param attribute attribute name, not null
    /// @param value the value, may be null
    /// @throws IllegalArgumentException if the blackboard has no such writable attribute
    @SuppressWarnings("unchecked")
    public static void write(Object blackboard, String attribute, Object value) {
        Objects.requireNonNull(blackboard, "blackboard must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (blackboard instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).put(attribute, value);
            return;
        }
        Class<?> type = blackboard.getClass();
        Method setter = findMethod(type, "set" + capitalize(attribute), 1);
        if (setter != null) {
            invoke(setter, blackboard, value);
            return;
        }
        Field field = findField(type, attribute);
        if (field == null || Modifier.isFinal(field.getModifiers())) {
            throw new IllegalArgumentException(
                    "No writable attribute '" + attribute + "' on " + type.getName());
        }
        try {
            field.setAccessible(true);
            field.set(blackboard, value);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot write attribute '" + attribute + "'", e);
        }
    }

    private static Method findMethod(Class<?> type, String name, int parameterCount) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Method method : c.getDeclaredMethods()) {
                if (method.getName().equals(name)
                        && method.getParameterCount() == parameterCount
                        && !Modifier.isStatic(method.getModifiers())
                        && (parameterCount == 1 || method.getReturnType() != void.class)) {
                    return method;
                }
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                    return field;
                }
            }
        }
        return null;
    }

    private static Object invoke(Method method, Object target, Object... args) {
        try {
            method.setAccessible(true);
            return method.invoke(target, args);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot access " + method.getName(), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(method.getName() + " failed", cause);
        }
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
