package io.tasktree.core.trace;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// {@link TraceStorage} keeping records in a concurrent map.
///
/// Records are snapshotted at save time, so later mutation of the trace tree
/// does not show up in stored records.
public class InMemoryTraceStorage implements TraceStorage {

    private static final Logger logger = Logger.getLogger(InMemoryTraceStorage.class.getName());

    private final Map<String, Map<String, Object>> records = new ConcurrentHashMap<>();

    @Override
    public String save(TraceNode root) {
        Objects.requireNonNull(root, "root must not be null");
        String id = UUID.randomUUID().toString();
        records.put(id, root.toRecord());
        logger.fine("Saved trace " + id + " for " + root.getFullName());
        return id;
    }

    @Override
    public Optional<Map<String, Object>> query(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(records.get(id));
    }

    /// Removes all stored records. Intended for tests.
    public void clear() {
        records.clear();
    }
}
