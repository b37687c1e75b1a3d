package io.tasktree.serialization;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Typed view of a persisted trace span, as read back from JSON.
///
/// Mirrors the shape produced by {@link io.tasktree.core.trace.TraceNode#toRecord()}.
/// Children are kept in the order they were opened.
///
/// @param name display name of the node
/// @param kind node kind tag
/// @param fullName slash-separated path of the node in its tree
/// @param startAt when the span was opened
/// @param endAt when the span was finished, null if it never finished
/// @param duration elapsed seconds
/// @param finished whether the span was finished
/// @param status `OK`, `FAIL`, or null when the node did not produce a result
/// @param cost cost recorded on this span alone
/// @param logs log lines in emission order
/// @param result textual form of the result, may be null
/// @param attributes span attributes
/// @param children child spans
public record TraceRecord(
        String name,
        String kind,
        @JsonProperty("fullname") String fullName,
        @JsonProperty("start_at") Instant startAt,
        @JsonProperty("end_at") Instant endAt,
        double duration,
        boolean finished,
        String status,
        double cost,
        List<String> logs,
        String result,
        Map<String, Object> attributes,
        List<TraceRecord> children) {

    public TraceRecord {
        logs = logs == null ? List.of() : List.copyOf(logs);
        attributes = attributes == null ? Map.of() : attributes;
        children = children == null ? List.of() : List.copyOf(children);
    }

    /// Sums the cost of this span and every span below it.
    ///
    /// @return the total cost
    public double totalCost() {
        double total = cost;
        for (TraceRecord child : children) {
            total += child.totalCost();
        }
        return total;
    }

    /// Finds the first span with the given full name, depth first.
    ///
    /// @param wanted full name to look for, not null
    /// @return the span, or empty if none matches
    public Optional<TraceRecord> find(String wanted) {
        if (wanted.equals(fullName)) {
            return Optional.of(this);
        }
        for (TraceRecord child : children) {
            Optional<TraceRecord> found = child.find(wanted);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
