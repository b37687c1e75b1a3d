package io.tasktree.core.cache;

import java.util.Objects;

/// Builds store keys for cached results.
///
/// A key is `prefix + [nodeFullName + ":"] + rawKey`, where the node segment is
/// only present for node-scoped caches.
public final class CacheKeys {

    private CacheKeys() {}

    /// @param prefix namespace prefix, may be null
    /// @param nodeFullName full name of the caching node, not null
    /// @param rawKey key produced by the key function, not null
    /// @param scopeToNode whether the node's full name is part of the key
    /// @return the store key, never null
    public static String derive(
            String prefix, String nodeFullName, String rawKey, boolean scopeToNode) {
        Objects.requireNonNull(nodeFullName, "nodeFullName must not be null");
        Objects.requireNonNull(rawKey, "rawKey must not be null");
        StringBuilder key = new StringBuilder();
        if (prefix != null) {
            key.append(prefix);
        }
        if (scopeToNode) {
            key.append(nodeFullName).append(':');
        }
        return key.append(rawKey).toString();
    }
}
