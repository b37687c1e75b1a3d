package io.tasktree.core;

import java.util.Map;

/// Configuration options for a task-tree execution environment.
///
/// Controls the random source used by random selectors. Fan-out nodes always
/// start their tasks on an unbounded pool of daemon threads; the number of
/// children running at once is bounded per node by its concurrency limit.
///
/// ### Default Values
/// - `randomSeed`: `null` (unseeded)
///
/// ### Settings keys
/// {@link #apply(Map)} understands the keys produced by
/// {@link TaskTreeFactory#loadSettingsFromEnvironment()} and
/// {@link TaskTreeFactory#loadSettingsFromProperties(java.util.Properties)}:
/// `tasktree.randomSeed`.
///
/// @implNote **Not thread-safe**. Configure before passing to {@link TaskTreeFactory}.
///
/// @see TaskTreeFactory#createEnvironment(TaskTreeConfig)
public class TaskTreeConfig {

    public static final String RANDOM_SEED = "tasktree.randomSeed";

    private Long randomSeed;

    public TaskTreeConfig() {}

    /// @return the seed for random selectors, or null for an unseeded source
    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    /// Applies recognised settings; unknown keys are ignored.
    ///
    /// @param settings settings keyed as described in the class docs, not null
    /// @return this config, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public TaskTreeConfig apply(Map<String, String> settings) {
        String seed = settings.get(RANDOM_SEED);
        if (seed != null) {
            setRandomSeed(parseNumber(RANDOM_SEED, seed));
        }
        return this;
    }

    private static Long parseNumber(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link TaskTreeConfig}.
    public static class Builder {
        private final TaskTreeConfig config = new TaskTreeConfig();

        public Builder randomSeed(long randomSeed) {
            config.setRandomSeed(randomSeed);
            return this;
        }

        public TaskTreeConfig build() {
            return config;
        }
    }
}
