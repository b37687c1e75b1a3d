package io.tasktree.core.trace;

import java.util.Map;
import java.util.Optional;

/// Persistence for finished trace trees.
///
/// Implementations store the {@link TraceNode#toRecord() record} form of a root
/// span. Records returned by {@link #query(String)} preserve at least the `name`,
/// `kind` and `children` fields.
///
/// @see InMemoryTraceStorage
public interface TraceStorage {

    /// Stores a snapshot of the given trace tree.
    ///
    /// @param root the root span of a run, not null
    /// @return an opaque identifier for later lookup, never null
    String save(TraceNode root);

    /// Loads a stored trace record.
    ///
    /// @param id identifier returned by {@link #save(TraceNode)}, not null
    /// @return the record, or empty if no trace is stored under the id
    Optional<Map<String, Object>> query(String id);
}
