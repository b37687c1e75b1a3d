package io.tasktree.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// {@link KeyValueStore} backed by a concurrent map, with lazy expiry.
///
/// Suitable for tests and single-process use.
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    /// @param clock time source for expiry, not null
    public InMemoryKeyValueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration expiration) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Instant expiresAt = expiration == null ? null : clock.instant().plus(expiration);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        entries.remove(key);
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    /// Removes all entries. Intended for tests.
    public void clear() {
        entries.clear();
    }
}
