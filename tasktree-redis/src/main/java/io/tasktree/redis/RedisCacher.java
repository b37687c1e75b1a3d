package io.tasktree.redis;

import io.tasktree.core.cache.CacheSettings;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.decorator.TerminableSettings;
import java.time.Duration;
import java.util.Objects;

/// Shortcuts for decorators backed by Redis.
///
/// {@snippet :
/// JedisKeyValueStore redis = JedisKeyValueStore.fromUrl("redis://127.0.0.1:6379");
/// Tree<Board> tree = Tree.<Board>builder("Answer")
///         .cacher(RedisCacher.settings(redis, b -> b.question, Duration.ofMinutes(1)))
///             .llm("gpt-4o-mini", b -> List.of(ChatMessage.user(b.question)))
///         .end()
///         .build();
/// }
public final class RedisCacher {

    /// Namespace of cache entries written through these settings.
    public static final String KEY_PREFIX = "tasktree:cache:";

    private RedisCacher() {}

    /// Starts cache settings bound to a Redis store and namespaced under {@link #KEY_PREFIX}.
    ///
    /// @param store the Redis store, not null
    /// @param <B> blackboard type
    /// @return a builder to add key, validator and expiration to, never null
    public static <B> CacheSettings.Builder<B> builder(JedisKeyValueStore store) {
        Objects.requireNonNull(store, "store must not be null");
        return CacheSettings.<B>builder().store(store).prefix(KEY_PREFIX);
    }

    /// @param store the Redis store, not null
    /// @param key derives the cache key from the blackboard, not null
    /// @param expiration time to live, null to keep entries until deleted
    /// @param <B> blackboard type
    /// @return cache settings, never null
    public static <B> CacheSettings<B> settings(
            JedisKeyValueStore store, BlackboardFunction<B, ?> key, Duration expiration) {
        return RedisCacher.<B>builder(store).key(key).expiration(expiration).build();
    }

    /// Terminable settings polling a Redis key for the termination signal.
    ///
    /// @param store the Redis store, not null
    /// @param signalKey derives the signal key from the blackboard, not null
    /// @param <B> blackboard type
    /// @return terminable settings with the default monitor interval, never null
    public static <B> TerminableSettings<B> terminable(
            JedisKeyValueStore store, BlackboardFunction<B, ?> signalKey) {
        Objects.requireNonNull(store, "store must not be null");
        return TerminableSettings.<B>builder().key(signalKey).store(store).build();
    }
}
