package io.tasktree.core.execution;

/// Restores the previously bound blackboard when closed.
///
/// {@snippet :
/// try (BlackboardScope scope = context.usingBlackboard(derived)) {
///     subtree.execute(context);
/// }
/// }
///
/// @see ExecutionContext#usingBlackboard(Object)
public final class BlackboardScope implements AutoCloseable {

    private final ExecutionContext context;
    private final Object previous;
    private boolean closed;

    BlackboardScope(ExecutionContext context, Object previous) {
        this.context = context;
        this.previous = previous;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            context.setBlackboard(previous);
        }
    }
}
