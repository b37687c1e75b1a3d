package io.tasktree.core.trace;

import io.tasktree.core.result.Result;
import io.tasktree.core.result.ResultStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One execution span in the trace tree of a run.
///
/// A trace node is opened when a node invocation starts and finished once its
/// result is known. Children are keyed by the child node's full name and kept
/// in insertion order. When the same node runs more than once under one parent
/// (a loop body, a retried child) the later spans are keyed `fullName#2`,
/// `fullName#3` and so on.
///
/// ### Contracts
/// - **Invariant**: `cost` starts at `0` and only changes through {@link #addCost(double)}
///   or {@link #setCost(double)}
/// - **Postcondition**: after {@link #finish(Result)} the node reports `finished == true`
///   and an end time, even when the result is null (cancelled or raised)
///
/// @implNote Thread-safe. Spawned tasks attach children to a shared parent
/// concurrently, so every accessor synchronizes on this node.
///
/// @see TraceStorage
public final class TraceNode {

    /// Name and kind of the synthetic span every run hangs off.
    public static final String ROOT = "ROOT";

    private final String name;
    private final String kind;
    private final String fullName;
    private final Instant startAt;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<String> logs = new ArrayList<>();
    private final Map<String, TraceNode> children = new LinkedHashMap<>();
    private Instant endAt;
    private Result result;
    private boolean finished;
    private double cost;

    public TraceNode(String name, String kind, String fullName) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.fullName = Objects.requireNonNull(fullName, "fullName must not be null");
        this.startAt = Instant.now();
    }

    /// Creates the root span of a run, named and kinded `ROOT`.
    ///
    /// @return a fresh root, never null
    public static TraceNode root() {
        return new TraceNode(ROOT, ROOT, ROOT);
    }

    /// Opens a child span and attaches it under this node.
    ///
    /// @param childName display name of the child node, not null
    /// @param childKind kind tag of the child node, not null
    /// @param childFullName full name of the child node, used as the key, not null
    /// @return the attached child, never null
    public synchronized TraceNode openChild(String childName, String childKind, String childFullName) {
        TraceNode child = new TraceNode(childName, childKind, childFullName);
        String key = childFullName;
        int occurrence = 1;
        while (children.containsKey(key)) {
            occurrence++;
            key = childFullName + "#" + occurrence;
        }
        children.put(key, child);
        return child;
    }

    /// Records the final result and end time. Later calls are ignored.
    ///
    /// @param finalResult the node's result, or null when it raised or was cancelled
    public synchronized void finish(Result finalResult) {
        if (finished) {
            return;
        }
        this.result = finalResult;
        this.endAt = Instant.now();
        this.finished = true;
    }

    public String getName() {
        return name;
    }

    public String getKind() {
        return kind;
    }

    public String getFullName() {
        return fullName;
    }

    public Instant getStartAt() {
        return startAt;
    }

    public synchronized Instant getEndAt() {
        return endAt;
    }

    public synchronized boolean isFinished() {
        return finished;
    }

    public synchronized Result getResult() {
        return result;
    }

    /// Returns the status of the recorded result.
    ///
    /// @return the status, or null while running or when the node did not produce a result
    public synchronized ResultStatus getStatus() {
        return result == null ? null : result.getStatus();
    }

    /// Returns the elapsed time, measured up to now while the span is still open.
    ///
    /// @return the duration, never null
    public synchronized Duration getDuration() {
        return Duration.between(startAt, endAt != null ? endAt : Instant.now());
    }

    public synchronized void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public synchronized Object getAttribute(String key) {
        return attributes.get(key);
    }

    /// @return a snapshot of the attributes in insertion order, never null
    public synchronized Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public synchronized double getCost() {
        return cost;
    }

    public synchronized void setCost(double cost) {
        this.cost = cost;
    }

    public synchronized void addCost(double amount) {
        this.cost += amount;
    }

    public synchronized void log(String message) {
        logs.add(message);
    }

    /// @return a snapshot of the log lines, never null
    public synchronized List<String> getLogs() {
        return List.copyOf(logs);
    }

    /// @return a snapshot of the children keyed by trace key, in insertion order, never null
    public synchronized Map<String, TraceNode> getChildren() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    /// Sums the cost of this span and all spans below it.
    ///
    /// @return the total cost
    public double getTotalCost() {
        double total = getCost();
        for (TraceNode child : getChildren().values()) {
            total += child.getTotalCost();
        }
        return total;
    }

    /// Converts this span and its subtree into plain maps and lists, the shape
    /// stored by {@link TraceStorage} implementations and read by the trace viewer.
    ///
    /// @return an insertion-ordered record, never null
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        List<Map<String, Object>> childRecords = new ArrayList<>();
        synchronized (this) {
            record.put("name", name);
            record.put("kind", kind);
            record.put("fullname", fullName);
            record.put("start_at", startAt.toString());
            record.put("end_at", endAt == null ? null : endAt.toString());
            record.put("duration", getDuration().toNanos() / 1_000_000_000.0);
            record.put("finished", finished);
            record.put("status", result == null ? null : result.getStatus().name());
            record.put("cost", cost);
            record.put("logs", new ArrayList<>(logs));
            record.put("result", result == null ? null : result.toString());
            record.put("attributes", new LinkedHashMap<>(attributes));
        }
        for (TraceNode child : getChildren().values()) {
            childRecords.add(child.toRecord());
        }
        record.put("children", childRecords);
        return record;
    }

    @Override
    public String toString() {
        return "TraceNode{" + fullName + ", kind=" + kind + ", status=" + getStatus() + "}";
    }
}
