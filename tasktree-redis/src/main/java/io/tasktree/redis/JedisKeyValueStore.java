package io.tasktree.redis;

import io.tasktree.core.cache.KeyValueStore;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/// Redis-backed {@link KeyValueStore} over a Jedis connection pool.
///
/// Used as the store of caching decorators and as the signal store of
/// terminable decorators when several processes share state. Every operation
/// borrows a connection and returns it before the call completes.
///
/// ### Settings
/// {@link #fromSettings(Map)} reads `tasktree.redisUrl` (environment variable
/// `TASKTREE_REDIS_URL`), defaulting to {@value #DEFAULT_URL}.
///
/// @implNote Thread-safe; the pool hands each caller its own connection. Redis
/// failures surface as unchecked `JedisException`s.
public class JedisKeyValueStore implements KeyValueStore, AutoCloseable {

    private static final Logger logger = Logger.getLogger(JedisKeyValueStore.class.getName());

    public static final String REDIS_URL = "tasktree.redisUrl";
    public static final String DEFAULT_URL = "redis://127.0.0.1:6379";

    private final JedisPool pool;

    /// @param pool connection pool, not null; closed by {@link #close()}
    public JedisKeyValueStore(JedisPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    public JedisKeyValueStore(String host, int port) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(host, "host must not be null"), port));
    }

    /// @param url a `redis://` or `rediss://` URL, not null
    /// @return a store with its own pool, never null
    public static JedisKeyValueStore fromUrl(String url) {
        Objects.requireNonNull(url, "url must not be null");
        logger.info("Connecting key-value store to " + URI.create(url).getHost());
        return new JedisKeyValueStore(new JedisPool(new JedisPoolConfig(), URI.create(url)));
    }

    /// @param settings task-tree settings as loaded by `TaskTreeFactory`, not null
    /// @return a store connected to the configured URL, never null
    public static JedisKeyValueStore fromSettings(Map<String, String> settings) {
        return fromUrl(settings.getOrDefault(REDIS_URL, DEFAULT_URL));
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try (var jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(key));
        }
    }

    @Override
    public void set(String key, String value, Duration expiration) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        try (var jedis = pool.getResource()) {
            if (expiration == null) {
                jedis.set(key, value);
            } else {
                // PSETEX rejects 0; sub-millisecond expirations round up
                jedis.psetex(key, Math.max(1L, expiration.toMillis()), value);
            }
        }
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try (var jedis = pool.getResource()) {
            jedis.del(key);
        }
    }

    @Override
    public boolean exists(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try (var jedis = pool.getResource()) {
            return jedis.exists(key);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
