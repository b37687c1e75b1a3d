package io.tasktree.core.execution;

import io.tasktree.core.GlobalDefaults;
import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.llm.ChatClient;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/// Per-run state threaded by reference through every node invocation.
///
/// Carries the current blackboard, the active trace span, the trace root of the
/// run and the services nodes pull what they need from (executor, random source,
/// key-value store, chat client).
///
/// ### Blackboard binding
/// The blackboard pointer is swapped with {@link #usingBlackboard(Object)}, which
/// restores the outer binding when the returned scope closes. A subtree can so
/// run against a derived blackboard without affecting its parent.
///
/// ### Spawned tasks
/// Fan-out nodes hand each child task a {@link #fork()}: it shares the trace root
/// and services but has its own blackboard, tracer and last-result pointers, so
/// concurrent branches never race on them.
///
/// @implNote The pointers are mutable and only safe to change from the thread
/// running this context. The blackboard object itself is not synchronized.
///
/// @see BlackboardScope
/// @see SpawnedTask
public final class ExecutionContext {

    // Shared by every fork of a run
    private final TraceNode traceRoot;
    private final ExecutorService executorService;
    private final Random random;
    private final KeyValueStore keyValueStore;
    private final ChatClient chatClient;

    // Set on forks only
    private final ExecutionContext parent;
    private volatile boolean cancelled;

    // Owned by the thread running this context
    private volatile Object blackboard;
    private volatile TraceNode tracer;
    private volatile Result lastResult;

    private ExecutionContext(Builder builder) {
        this.traceRoot = builder.traceRoot != null ? builder.traceRoot : TraceNode.root();
        this.executorService =
                builder.executorService != null
                        ? builder.executorService
                        : GlobalDefaults.getExecutorService();
        this.random = builder.random != null ? builder.random : new Random();
        this.keyValueStore = builder.keyValueStore;
        this.chatClient = builder.chatClient;
        this.parent = null;
        this.blackboard = builder.blackboard;
        this.tracer = traceRoot;
    }

    private ExecutionContext(ExecutionContext parent, Object blackboard) {
        this.traceRoot = parent.traceRoot;
        this.executorService = parent.executorService;
        this.random = parent.random;
        this.keyValueStore = parent.keyValueStore;
        this.chatClient = parent.chatClient;
        this.parent = parent;
        this.blackboard = blackboard;
        this.tracer = parent.tracer;
        this.lastResult = parent.lastResult;
    }

    /// Creates a context with default services and a fresh trace root.
    ///
    /// @return a new context without a bound blackboard, never null
    public static ExecutionContext create() {
        return builder().build();
    }

    /// Returns the bound blackboard.
    ///
    /// @param <B> blackboard type expected by the caller
    /// @return the blackboard, may be null if none is bound
    @SuppressWarnings("unchecked")
    public <B> B getBlackboard() {
        return (B) blackboard;
    }

    /// Binds a blackboard until the returned scope is closed.
    ///
    /// @param newBlackboard the blackboard to bind, may be null
    /// @return a scope restoring the previous binding on close, never null
    public BlackboardScope usingBlackboard(Object newBlackboard) {
        BlackboardScope scope = new BlackboardScope(this, blackboard);
        this.blackboard = newBlackboard;
        return scope;
    }

    void setBlackboard(Object blackboard) {
        this.blackboard = blackboard;
    }

    /// Derives the context for a spawned task running against the same blackboard.
    ///
    /// @return a forked context, never null
    public ExecutionContext fork() {
        return new ExecutionContext(this, blackboard);
    }

    /// Derives the context for a spawned task running against its own blackboard.
    ///
    /// @param derivedBlackboard blackboard of the task, may be null
    /// @return a forked context, never null
    public ExecutionContext fork(Object derivedBlackboard) {
        return new ExecutionContext(this, derivedBlackboard);
    }

    /// Marks this context, and every fork derived from it, as cancelled.
    void cancel() {
        this.cancelled = true;
    }

    /// Returns whether the task running on this context, or any task it was
    /// forked from, has been cancelled.
    ///
    /// @return `true` once cancelled
    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public TraceNode getTraceRoot() {
        return traceRoot;
    }

    /// @return the span of the node currently executing on this context, never null
    public TraceNode getTracer() {
        return tracer;
    }

    public void setTracer(TraceNode tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /// Returns the result of the most recently finished node on this context.
    ///
    /// @return the last result, or null before the first node finishes
    public Result getLastResult() {
        return lastResult;
    }

    public void setLastResult(Result lastResult) {
        this.lastResult = lastResult;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public Random getRandom() {
        return random;
    }

    /// Returns the key-value store configured for this run, falling back to the
    /// process-wide default.
    ///
    /// @return the store, or null if neither is configured
    public KeyValueStore getKeyValueStore() {
        return keyValueStore != null ? keyValueStore : GlobalDefaults.getKeyValueStore();
    }

    /// Returns the chat client configured for this run, falling back to the
    /// process-wide default.
    ///
    /// @return the client, or null if neither is configured
    public ChatClient getChatClient() {
        return chatClient != null ? chatClient : GlobalDefaults.getChatClient();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing {@link ExecutionContext} instances.
    ///
    /// Every field is optional. Unset services fall back to {@link GlobalDefaults}.
    public static final class Builder {
        private Object blackboard;
        private TraceNode traceRoot;
        private ExecutorService executorService;
        private Random random;
        private KeyValueStore keyValueStore;
        private ChatClient chatClient;

        private Builder() {}

        public Builder blackboard(Object blackboard) {
            this.blackboard = blackboard;
            return this;
        }

        public Builder traceRoot(TraceNode traceRoot) {
            this.traceRoot = traceRoot;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Sets the random source used by randomized nodes. Pass a seeded
        /// instance for reproducible orderings.
        ///
        /// @param random the random source, may be null for an unseeded one
        /// @return this builder for chaining, never null
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder keyValueStore(KeyValueStore keyValueStore) {
            this.keyValueStore = keyValueStore;
            return this;
        }

        public Builder chatClient(ChatClient chatClient) {
            this.chatClient = chatClient;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
