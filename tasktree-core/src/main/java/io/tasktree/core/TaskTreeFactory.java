package io.tasktree.core;

import io.tasktree.core.cache.InMemoryKeyValueStore;
import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.llm.ApiKeyFactory;
import io.tasktree.core.llm.ChatClient;
import io.tasktree.core.llm.StubChatClient;
import io.tasktree.core.trace.InMemoryTraceStorage;
import io.tasktree.core.trace.TraceStorage;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link TaskTreeEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with explicit collaborators**:
/// {@snippet :
/// var env = TaskTreeFactory.builder()
///     .config(TaskTreeConfig.builder().randomSeed(42).build())
///     .keyValueStore(new JedisKeyValueStore(pool))
///     .chatClient(new LangChain4jChatClient(models))
///     .build();
/// }
///
/// **Quick start with environment variables**:
/// {@snippet :
/// var env = TaskTreeFactory.createEnvironment();
/// }
///
/// ### Settings sources
/// Environment variables `TASKTREE_<NAME>` map to `tasktree.<name>` with the
/// underscore-separated name converted to camel case, so
/// `TASKTREE_RANDOM_SEED=4` becomes `tasktree.randomSeed=4`.
/// Properties are read from keys starting with `tasktree.` as they are.
///
/// @see TaskTreeEnvironment
/// @see TaskTreeConfig
public final class TaskTreeFactory {

    private static final Logger logger = Logger.getLogger(TaskTreeFactory.class.getName());

    private static final String ENV_PREFIX = "TASKTREE_";
    private static final String PROPERTY_PREFIX = "tasktree.";

    /// Settings key that wires a {@link StubChatClient} when no client is given.
    public static final String STUB_LLM = "tasktree.stubLlm";

    private TaskTreeFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment configured from `TASKTREE_*` environment variables.
    ///
    /// @apiNote **Side effects**: reads the process environment and creates a worker pool.
    ///
    /// @return a fully-configured environment, never null
    public static TaskTreeEnvironment createEnvironment() {
        Map<String, String> settings = loadSettingsFromEnvironment();
        return createEnvironment(new TaskTreeConfig().apply(settings), settings);
    }

    /// Creates an environment with the given configuration and in-memory collaborators.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured environment, never null
    public static TaskTreeEnvironment createEnvironment(TaskTreeConfig config) {
        return createEnvironment(config, Map.of());
    }

    /// Creates an environment with the given configuration and settings. This is
    /// the overload the others delegate to.
    ///
    /// @param config configuration, not null
    /// @param settings additional settings, e.g. {@link #STUB_LLM}, not null (may be empty)
    /// @return a fully-configured environment, never null
    public static TaskTreeEnvironment createEnvironment(
            TaskTreeConfig config, Map<String, String> settings) {
        return builder().config(config).settings(settings).build();
    }

    /// Reads `TASKTREE_*` environment variables.
    ///
    /// @return settings keyed `tasktree.<camelCaseName>`, never null (may be empty)
    public static Map<String, String> loadSettingsFromEnvironment() {
        return settingsFromEnvironment(System.getenv());
    }

    static Map<String, String> settingsFromEnvironment(Map<String, String> environment) {
        Map<String, String> settings = new HashMap<>();
        environment.forEach(
                (key, value) -> {
                    if (value != null && !value.isEmpty() && key.startsWith(ENV_PREFIX)) {
                        settings.put(PROPERTY_PREFIX + camelCase(key.substring(ENV_PREFIX.length())), value);
                    }
                });
        return settings;
    }

    /// Reads `tasktree.*` keys from properties.
    ///
    /// @param properties the properties, not null
    /// @return matching settings, never null (may be empty)
    public static Map<String, String> loadSettingsFromProperties(Properties properties) {
        Map<String, String> settings = new HashMap<>();
        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (keyStr.startsWith(PROPERTY_PREFIX) && !valueStr.isEmpty()) {
                        settings.put(keyStr, valueStr);
                    }
                });
        return settings;
    }

    /// Merges environment variables and properties; properties win.
    ///
    /// @param properties the properties, not null
    /// @return merged settings, never null
    public static Map<String, String> loadSettings(Properties properties) {
        Map<String, String> settings = loadSettingsFromEnvironment();
        settings.putAll(loadSettingsFromProperties(properties));
        return settings;
    }

    static String camelCase(String upperSnake) {
        StringBuilder out = new StringBuilder();
        boolean upperNext = false;
        for (char c : upperSnake.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '_') {
                upperNext = out.length() > 0;
            } else {
                out.append(upperNext ? Character.toUpperCase(c) : c);
                upperNext = false;
            }
        }
        return out.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TaskTreeEnvironment}.
    ///
    /// Collaborators left unset default to in-memory implementations and a
    /// cached pool of daemon threads.
    ///
    /// @implNote **Not thread-safe**.
    public static class Builder {
        private TaskTreeConfig config = new TaskTreeConfig();
        private final Map<String, String> settings = new HashMap<>();
        private ExecutorService executorService;
        private KeyValueStore keyValueStore;
        private TraceStorage traceStorage;
        private ChatClient chatClient;
        private ApiKeyFactory apiKeyFactory;

        public Builder config(TaskTreeConfig config) {
            this.config = config;
            return this;
        }

        /// Adds settings; they are applied to the config on {@link #build()}.
        public Builder settings(Map<String, String> settings) {
            this.settings.putAll(settings);
            return this;
        }

        public Builder setting(String key, String value) {
            this.settings.put(key, value);
            return this;
        }

        public Builder loadSettingsFromEnvironment() {
            return settings(TaskTreeFactory.loadSettingsFromEnvironment());
        }

        public Builder loadSettingsFromProperties(Properties properties) {
            return settings(TaskTreeFactory.loadSettingsFromProperties(properties));
        }

        /// Sets the pool that fan-out nodes start their child tasks on.
        ///
        /// A started task blocks its thread while it waits for the tasks it
        /// started itself (Timeout, Terminable, nested Parallel), so the pool
        /// must not be bounded below the tree's nesting of such nodes. An
        /// unbounded pool is always safe; concurrency is limited per node.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder keyValueStore(KeyValueStore keyValueStore) {
            this.keyValueStore = keyValueStore;
            return this;
        }

        public Builder traceStorage(TraceStorage traceStorage) {
            this.traceStorage = traceStorage;
            return this;
        }

        public Builder chatClient(ChatClient chatClient) {
            this.chatClient = chatClient;
            return this;
        }

        public Builder apiKeyFactory(ApiKeyFactory apiKeyFactory) {
            this.apiKeyFactory = apiKeyFactory;
            return this;
        }

        /// @return the configured environment, never null
        /// @throws IllegalArgumentException if a setting value is invalid
        public TaskTreeEnvironment build() {
            config.apply(settings);
            if (executorService == null) {
                executorService = Executors.newCachedThreadPool(GlobalDefaults.daemonThreads("tasktree-env-"));
            }
            if (keyValueStore == null) {
                keyValueStore = new InMemoryKeyValueStore();
            }
            if (traceStorage == null) {
                traceStorage = new InMemoryTraceStorage();
            }
            if (chatClient == null && Boolean.parseBoolean(settings.get(STUB_LLM))) {
                logger.info("Using stub chat client");
                chatClient = new StubChatClient();
            }
            return new TaskTreeEnvironment(
                    config, executorService, keyValueStore, traceStorage, chatClient, apiKeyFactory);
        }
    }
}
