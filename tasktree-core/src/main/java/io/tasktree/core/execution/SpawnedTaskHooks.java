package io.tasktree.core.execution;

import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Process-wide registry of {@link SpawnedTaskHook}s.
///
/// Hooks are registered at startup. Tests that register hooks take a
/// {@link #snapshot()} first and {@link #restore(List)} it afterwards.
///
/// @implNote Backed by a copy-on-write list: registration is rare, firing
/// happens from many task threads at once.
public final class SpawnedTaskHooks {

    private static final Logger logger = Logger.getLogger(SpawnedTaskHooks.class.getName());

    private static final CopyOnWriteArrayList<SpawnedTaskHook> hooks =
            new CopyOnWriteArrayList<>();

    private SpawnedTaskHooks() {}

    public static void register(SpawnedTaskHook hook) {
        hooks.add(Objects.requireNonNull(hook, "hook must not be null"));
    }

    public static boolean unregister(SpawnedTaskHook hook) {
        return hooks.remove(hook);
    }

    public static void clear() {
        hooks.clear();
    }

    /// @return the currently registered hooks in registration order, never null
    public static List<SpawnedTaskHook> snapshot() {
        return List.copyOf(hooks);
    }

    /// Replaces the registered hooks with a previously taken snapshot.
    ///
    /// @param saved hooks to reinstate, not null
    public static void restore(List<SpawnedTaskHook> saved) {
        Objects.requireNonNull(saved, "saved must not be null");
        hooks.clear();
        hooks.addAll(saved);
    }

    /// Invokes every registered hook. A failing hook is logged and does not stop
    /// the others or affect the run.
    static void fire(ExecutionContext context, TraceNode trace, Result result) {
        for (SpawnedTaskHook hook : hooks) {
            try {
                hook.onFinished(context, trace, result);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Spawned task hook failed: " + e.getMessage(), e);
            }
        }
    }
}
