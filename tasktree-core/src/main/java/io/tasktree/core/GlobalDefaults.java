package io.tasktree.core;

import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.llm.ApiKeyFactory;
import io.tasktree.core.llm.ChatClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Process-wide defaults used when neither a node nor the run's
/// {@link io.tasktree.core.execution.ExecutionContext} configures a collaborator.
///
/// ### Lifecycle
/// Set once at startup (directly or through {@link TaskTreeEnvironment#installAsDefaults()}).
/// Tests that change a default call {@link #reset()} afterwards.
///
/// @implNote Fields are volatile; a change is visible to runs started after it.
public final class GlobalDefaults {

    private static final Logger logger = Logger.getLogger(GlobalDefaults.class.getName());

    private static volatile KeyValueStore keyValueStore;
    private static volatile ChatClient chatClient;
    private static volatile ApiKeyFactory apiKeyFactory;
    private static volatile ExecutorService executorService;

    private GlobalDefaults() {}

    public static KeyValueStore getKeyValueStore() {
        return keyValueStore;
    }

    public static void setKeyValueStore(KeyValueStore store) {
        keyValueStore = store;
    }

    public static ChatClient getChatClient() {
        return chatClient;
    }

    public static void setChatClient(ChatClient client) {
        chatClient = client;
    }

    public static ApiKeyFactory getApiKeyFactory() {
        return apiKeyFactory;
    }

    public static void setApiKeyFactory(ApiKeyFactory factory) {
        apiKeyFactory = factory;
    }

    /// Returns the executor used by contexts created without one, creating a
    /// shared cached pool of daemon threads on first use.
    ///
    /// @return the executor, never null
    public static ExecutorService getExecutorService() {
        ExecutorService current = executorService;
        if (current == null) {
            synchronized (GlobalDefaults.class) {
                current = executorService;
                if (current == null) {
                    current = Executors.newCachedThreadPool(daemonThreads("tasktree-worker-"));
                    executorService = current;
                    logger.fine("Created shared task executor");
                }
            }
        }
        return current;
    }

    public static void setExecutorService(ExecutorService executor) {
        executorService = executor;
    }

    /// Clears every default. The shared executor, if one was created, is left
    /// running for tasks still in flight and replaced on next use.
    public static void reset() {
        keyValueStore = null;
        chatClient = null;
        apiKeyFactory = null;
        executorService = null;
    }

    /// Thread factory producing named daemon threads.
    ///
    /// @param prefix thread name prefix, not null
    /// @return the factory, never null
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
