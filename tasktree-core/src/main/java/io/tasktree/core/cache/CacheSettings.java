package io.tasktree.core.cache;

import io.tasktree.core.function.BlackboardFunction;
import java.time.Duration;

/// Configuration of a caching decorator.
///
/// ### Fields
/// - `key`: derives the raw cache key from the blackboard (required)
/// - `store`: where entries live; null falls back to the run's store, then to
///   {@link io.tasktree.core.GlobalDefaults}
/// - `expiration`: time to live of written entries, null for none
/// - `validator`: derives a tag stored with the entry; an entry whose tag differs
///   from the current one is treated as a miss
/// - `prefix`: namespace prepended to every key
/// - `dataType`: type cached data is decoded into, null for plain JSON values
/// - `scopeToNode`: include the node's full name in the key
///
/// @param <B> blackboard type
/// @see CacheKeys
public final class CacheSettings<B> {

    private final BlackboardFunction<B, ?> key;
    private final KeyValueStore store;
    private final Duration expiration;
    private final BlackboardFunction<B, ?> validator;
    private final String prefix;
    private final Class<?> dataType;
    private final boolean scopeToNode;

    private CacheSettings(Builder<B> builder) {
        this.key = builder.key;
        this.store = builder.store;
        this.expiration = builder.expiration;
        this.validator = builder.validator;
        this.prefix = builder.prefix;
        this.dataType = builder.dataType;
        this.scopeToNode = builder.scopeToNode;
    }

    public BlackboardFunction<B, ?> getKey() {
        return key;
    }

    public KeyValueStore getStore() {
        return store;
    }

    public Duration getExpiration() {
        return expiration;
    }

    public BlackboardFunction<B, ?> getValidator() {
        return validator;
    }

    public String getPrefix() {
        return prefix;
    }

    public Class<?> getDataType() {
        return dataType;
    }

    public boolean isScopeToNode() {
        return scopeToNode;
    }

    public static <B> Builder<B> builder() {
        return new Builder<>();
    }

    public static final class Builder<B> {
        private BlackboardFunction<B, ?> key;
        private KeyValueStore store;
        private Duration expiration;
        private BlackboardFunction<B, ?> validator;
        private String prefix;
        private Class<?> dataType;
        private boolean scopeToNode;

        private Builder() {}

        public Builder<B> key(BlackboardFunction<B, ?> key) {
            this.key = key;
            return this;
        }

        public Builder<B> store(KeyValueStore store) {
            this.store = store;
            return this;
        }

        public Builder<B> expiration(Duration expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder<B> validator(BlackboardFunction<B, ?> validator) {
            this.validator = validator;
            return this;
        }

        public Builder<B> prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder<B> dataType(Class<?> dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder<B> scopeToNode(boolean scopeToNode) {
            this.scopeToNode = scopeToNode;
            return this;
        }

        /// @return the settings, never null
        /// @throws IllegalStateException if no key function is set or the expiration is not positive
        public CacheSettings<B> build() {
            if (key == null) {
                throw new IllegalStateException("Cache key function is required");
            }
            if (expiration != null && (expiration.isNegative() || expiration.isZero())) {
                throw new IllegalStateException("Cache expiration must be positive: " + expiration);
            }
            return new CacheSettings<>(this);
        }
    }
}
