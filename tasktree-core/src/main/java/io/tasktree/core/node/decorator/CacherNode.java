package io.tasktree.core.node.decorator;

import io.tasktree.core.cache.CacheCodec;
import io.tasktree.core.cache.CacheEntry;
import io.tasktree.core.cache.CacheKeys;
import io.tasktree.core.cache.CacheSettings;
import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Memoizes the child's successful results in a {@link KeyValueStore}.
///
/// ### Protocol
/// 1. derive the key from the blackboard ({@link CacheKeys})
/// 2. hit: an entry exists and, if a validator is configured, its stored tag
///    equals the current one; return `OK(cached data)` without running the child
/// 3. otherwise (miss, or stale tag) run the child; on `OK` write the data and
///    the current tag with the configured expiration
///
/// The trace attribute `cache` records `hit`, `miss` or `stale`. An entry that
/// cannot be decoded is treated as a miss and overwritten. A failed write
/// (unencodable data, store error) is logged and recorded as the trace
/// attribute `cache_write_error`; the child's result is returned as is.
///
/// @param <B> blackboard type
/// @see CacheSettings
public class CacherNode<B> extends DecoratorNode<B> {

    private static final Logger logger = Logger.getLogger(CacherNode.class.getName());

    private final CacheSettings<B> settings;

    public CacherNode(CacheSettings<B> settings) {
        super(NodeKinds.CACHER);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        KeyValueStore store = settings.getStore() != null ? settings.getStore() : context.getKeyValueStore();
        if (store == null) {
            throw new TreeProgrammingException(
                    "Cacher '" + getFullName() + "' has no key-value store configured");
        }
        B blackboard = blackboard(context);
        String rawKey = String.valueOf(settings.getKey().apply(blackboard));
        String key = CacheKeys.derive(settings.getPrefix(), getFullName(), rawKey, settings.isScopeToNode());
        String validator = currentValidator(blackboard);
        trace.setAttribute("cache_key", key);

        Optional<String> stored = store.get(key);
        String outcome = "miss";
        if (stored.isPresent()) {
            CacheEntry entry = decode(key, stored.get());
            if (entry != null) {
                if (settings.getValidator() == null || Objects.equals(entry.validator(), validator)) {
                    trace.setAttribute("cache", "hit");
                    logger.fine("Cache hit: " + key);
                    return Result.ok(entry.data());
                }
                outcome = "stale";
            }
        }
        trace.setAttribute("cache", outcome);
        logger.fine("Cache " + outcome + ": " + key);

        Result result = primary().execute(context);
        if (result.isOk()) {
            write(store, key, new CacheEntry(validator, result.getData()), trace);
        }
        return result;
    }

    private void write(KeyValueStore store, String key, CacheEntry entry, TraceNode trace) {
        try {
            store.set(key, CacheCodec.encode(entry), settings.getExpiration());
        } catch (RuntimeException e) {
            logger.warning("Failed to write cache entry " + key + ": " + e.getMessage());
            trace.setAttribute("cache_write_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private String currentValidator(B blackboard) throws Exception {
        if (settings.getValidator() == null) {
            return null;
        }
        Object tag = settings.getValidator().apply(blackboard);
        return tag == null ? null : String.valueOf(tag);
    }

    private CacheEntry decode(String key, String raw) {
        try {
            return CacheCodec.decode(raw, settings.getDataType());
        } catch (IllegalArgumentException e) {
            logger.warning("Ignoring unreadable cache entry " + key + ": " + e.getMessage());
            return null;
        }
    }
}
