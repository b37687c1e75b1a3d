package io.tasktree.core.node.decorator;

import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.function.BlackboardFunction;
import java.time.Duration;

/// Configuration of a {@link TerminableNode}.
///
/// - `key`: derives the signal key from the blackboard (required)
/// - `store`: where the signal is looked up; null falls back to the run's store
/// - `monitorInterval`: how often the signal is polled, default 100 ms
///
/// @param <B> blackboard type
public final class TerminableSettings<B> {

    public static final Duration DEFAULT_MONITOR_INTERVAL = Duration.ofMillis(100);

    private final BlackboardFunction<B, ?> key;
    private final KeyValueStore store;
    private final Duration monitorInterval;

    private TerminableSettings(Builder<B> builder) {
        this.key = builder.key;
        this.store = builder.store;
        this.monitorInterval = builder.monitorInterval;
    }

    public BlackboardFunction<B, ?> getKey() {
        return key;
    }

    public KeyValueStore getStore() {
        return store;
    }

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public static <B> Builder<B> builder() {
        return new Builder<>();
    }

    public static final class Builder<B> {
        private BlackboardFunction<B, ?> key;
        private KeyValueStore store;
        private Duration monitorInterval = DEFAULT_MONITOR_INTERVAL;

        private Builder() {}

        public Builder<B> key(BlackboardFunction<B, ?> key) {
            this.key = key;
            return this;
        }

        public Builder<B> store(KeyValueStore store) {
            this.store = store;
            return this;
        }

        public Builder<B> monitorInterval(Duration monitorInterval) {
            this.monitorInterval = monitorInterval;
            return this;
        }

        /// @return the settings, never null
        /// @throws IllegalStateException if no key function is set or the interval is not positive
        public TerminableSettings<B> build() {
            if (key == null) {
                throw new IllegalStateException("Terminable key function is required");
            }
            if (monitorInterval == null || monitorInterval.isNegative() || monitorInterval.isZero()) {
                throw new IllegalStateException(
                        "Terminable monitor interval must be positive: " + monitorInterval);
            }
            return new TerminableSettings<>(this);
        }
    }
}
