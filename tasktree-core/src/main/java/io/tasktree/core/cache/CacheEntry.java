package io.tasktree.core.cache;

/// What the cacher stores under a key: the cached data and the validator tag
/// that was current when it was written.
///
/// @param validator validator tag, null when no validator was configured
/// @param data cached result data, may be null
public record CacheEntry(String validator, Object data) {}
