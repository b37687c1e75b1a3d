package io.tasktree.core.cache;

import java.time.Duration;
import java.util.Optional;

/// Minimal external key-value store used by the cacher and by the termination
/// signal check.
///
/// Implementations must be safe for concurrent use from spawned tasks.
///
/// @see InMemoryKeyValueStore
public interface KeyValueStore {

    /// @param key the key, not null
    /// @return the stored value, or empty if absent or expired
    Optional<String> get(String key);

    /// Stores a value.
    ///
    /// @param key the key, not null
    /// @param value the value, not null
    /// @param expiration time to live, or null to keep the value until deleted
    void set(String key, String value, Duration expiration);

    /// @param key the key, not null
    void delete(String key);

    /// @param key the key, not null
    /// @return `true` if a value is stored and not expired
    boolean exists(String key);
}
