package io.tasktree.core;

import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.llm.ApiKeyFactory;
import io.tasktree.core.llm.ChatClient;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.trace.TraceStorage;
import io.tasktree.core.tree.Tree;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding the collaborators tree runs are wired against.
///
/// Owns the worker pool and hands out {@link ExecutionContext}s bound to it and
/// to the environment's key-value store and chat client. Finished runs can be
/// persisted to the environment's {@link TraceStorage}.
///
/// ### Contracts
/// - **Precondition**: executor, key-value store and trace storage are non-null
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent use; every run gets its own context.
///
/// @apiNote Create instances via {@link TaskTreeFactory#createEnvironment()} or
/// {@link TaskTreeFactory.Builder}.
public final class TaskTreeEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(TaskTreeEnvironment.class.getName());

    private final TaskTreeConfig config;
    private final ExecutorService executorService;
    private final KeyValueStore keyValueStore;
    private final TraceStorage traceStorage;
    private final ChatClient chatClient;
    private final ApiKeyFactory apiKeyFactory;
    private final Random sharedRandom;

    /// @param config configuration the environment was built from, not null
    /// @param executorService worker pool for fan-out nodes, not null
    /// @param keyValueStore store for caching and termination signals, not null
    /// @param traceStorage destination of saved traces, not null
    /// @param chatClient client for LLM nodes, may be null
    /// @param apiKeyFactory per-run API key source, may be null
    public TaskTreeEnvironment(
            TaskTreeConfig config,
            ExecutorService executorService,
            KeyValueStore keyValueStore,
            TraceStorage traceStorage,
            ChatClient chatClient,
            ApiKeyFactory apiKeyFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executorService = Objects.requireNonNull(executorService, "executorService must not be null");
        this.keyValueStore = Objects.requireNonNull(keyValueStore, "keyValueStore must not be null");
        this.traceStorage = Objects.requireNonNull(traceStorage, "traceStorage must not be null");
        this.chatClient = chatClient;
        this.apiKeyFactory = apiKeyFactory;
        this.sharedRandom = config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : null;
    }

    public TaskTreeConfig getConfig() {
        return config;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    public KeyValueStore getKeyValueStore() {
        return keyValueStore;
    }

    public TraceStorage getTraceStorage() {
        return traceStorage;
    }

    /// @return the chat client, may be null when no LLM nodes are used
    public ChatClient getChatClient() {
        return chatClient;
    }

    /// @return the API key factory, may be null
    public ApiKeyFactory getApiKeyFactory() {
        return apiKeyFactory;
    }

    /// Creates a context wired to this environment's collaborators.
    ///
    /// With a configured seed, all contexts share one seeded random source, so
    /// sequential runs are reproducible.
    ///
    /// @return a new context with a fresh trace root, never null
    public ExecutionContext newContext() {
        return ExecutionContext.builder()
                .executorService(executorService)
                .keyValueStore(keyValueStore)
                .chatClient(chatClient)
                .random(sharedRandom != null ? sharedRandom : new Random())
                .build();
    }

    /// Runs a tree on a new context and saves its trace.
    ///
    /// @param tree the tree to run, not null
    /// @param blackboard the blackboard, may be null
    /// @param <B> blackboard type
    /// @return the result, the trace and its storage id, never null
    public <B> TracedRun run(Tree<B> tree, B blackboard) {
        Objects.requireNonNull(tree, "tree must not be null");
        ExecutionContext context = newContext();
        Result result = tree.run(blackboard, context);
        TraceNode trace = context.getTraceRoot();
        trace.finish(result);
        String traceId = traceStorage.save(trace);
        logger.fine("Saved trace of " + tree.getName() + " as " + traceId);
        return new TracedRun(result, trace, traceId);
    }

    /// Makes this environment's collaborators the process-wide defaults used by
    /// contexts created without an environment.
    ///
    /// @apiNote **Side effects**: overwrites the store, chat client, API key
    /// factory and executor in {@link GlobalDefaults}.
    public void installAsDefaults() {
        GlobalDefaults.setExecutorService(executorService);
        GlobalDefaults.setKeyValueStore(keyValueStore);
        if (chatClient != null) {
            GlobalDefaults.setChatClient(chatClient);
        }
        if (apiKeyFactory != null) {
            GlobalDefaults.setApiKeyFactory(apiKeyFactory);
        }
        logger.info("Installed task-tree environment as process defaults");
    }

    /// Shuts down the worker pool, waiting briefly for running tasks.
    ///
    /// @apiNote **Side effects**: no new tasks are accepted after this call.
    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Worker pool did not terminate in time, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
