package io.tasktree.core.node;

import io.tasktree.core.exception.NodeCancelledException;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Base class of every executable unit of a tree.
///
/// Subclasses implement {@link #doExecute(ExecutionContext, TraceNode)}. The
/// final {@link #execute(ExecutionContext)} wraps it with tracing and the
/// failure policy shared by all node kinds.
///
/// ### Failure policy
/// - {@link TreeProgrammingException} propagates unchanged
/// - {@link NodeCancelledException} propagates unchanged; an
///   `InterruptedException` is converted into one
/// - any other exception, and `AssertionError`, becomes `FAIL(null)` at this
///   node; its type and message are recorded as the `error` trace attribute
///
/// ### Topology
/// Children are attached while the tree is built. {@link #seal(String)} assigns
/// full names, validates structure and freezes the subtree; attaching after
/// that is a programming error.
///
/// @param <B> blackboard type
/// @see io.tasktree.core.tree.TreeBuilder
public abstract class Node<B> {

    private static final Logger logger = Logger.getLogger(Node.class.getName());

    /// Separator between path segments of a full name.
    public static final String PATH_SEPARATOR = "/";

    private final String kind;
    private final List<Node<B>> children = new ArrayList<>();
    private String name;
    private String fullName;
    private boolean sealed;

    protected Node(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = kind;
    }

    public final String getKind() {
        return kind;
    }

    public final String getName() {
        return name;
    }

    /// Overrides the default name (the kind). Only allowed before the tree is built.
    ///
    /// @param name display name, not null or blank
    /// @throws TreeProgrammingException if the node is already sealed or the name is blank
    public final void setName(String name) {
        checkNotSealed();
        if (name == null || name.isBlank()) {
            throw new TreeProgrammingException("Node name must not be blank");
        }
        this.name = name;
    }

    /// Returns the path of this node from the root of its tree.
    ///
    /// @return the full name, or the plain name before the tree is built
    public final String getFullName() {
        return fullName != null ? fullName : name;
    }

    public final List<Node<B>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    protected final Node<B> child(int index) {
        return children.get(index);
    }

    protected final int childCount() {
        return children.size();
    }

    public final boolean isSealed() {
        return sealed;
    }

    /// Maximum number of children. `0` for leaves.
    ///
    /// @return the child capacity
    public abstract int maxChildren();

    /// Minimum number of children a built tree must give this node.
    ///
    /// @return the required child count
    public int minChildren() {
        return 0;
    }

    /// Attaches a child.
    ///
    /// @param child node to attach, not null
    /// @throws TreeProgrammingException if this node is sealed or full, or the
    ///         child is rejected by {@link #checkChild(Node, int)}
    public final void addChild(Node<B> child) {
        Objects.requireNonNull(child, "child must not be null");
        checkNotSealed();
        if (children.size() >= maxChildren()) {
            throw new TreeProgrammingException(
                    kind
                            + " '"
                            + name
                            + "' accepts at most "
                            + maxChildren()
                            + " child node(s), cannot attach "
                            + child.getKind());
        }
        checkChild(child, children.size());
        children.add(child);
    }

    /// Hook for node kinds that restrict what may be attached at a position.
    ///
    /// @param child candidate child, not null
    /// @param position zero-based position it would take
    /// @throws TreeProgrammingException if the child is not allowed there
    protected void checkChild(Node<B> child, int position) {
        Set<String> allowed = child.allowedParentKinds();
        if (!allowed.isEmpty() && !allowed.contains(kind)) {
            throw new TreeProgrammingException(
                    child.getKind() + " can only be attached to " + allowed + ", not to " + kind);
        }
    }

    /// Kinds a parent must have for this node to be attached, e.g. `If` for `Else`.
    ///
    /// @return the allowed parent kinds, empty if any parent is fine
    protected Set<String> allowedParentKinds() {
        return Set.of();
    }

    /// Node-specific structural checks run when the tree is built.
    ///
    /// @throws TreeProgrammingException on invalid configuration
    protected void validate() {}

    /// Assigns full names below `parentPath`, validates and freezes this subtree.
    ///
    /// Sibling names that repeat are suffixed `-2`, `-3`, ... so every full name
    /// in a tree is unique.
    ///
    /// @param parentPath full name of the parent, or null for a tree root
    /// @throws TreeProgrammingException on structural errors
    public final void seal(String parentPath) {
        if (sealed) {
            return;
        }
        if (children.size() < minChildren()) {
            throw new TreeProgrammingException(
                    kind
                            + " '"
                            + name
                            + "' requires at least "
                            + minChildren()
                            + " child node(s), got "
                            + children.size());
        }
        validate();
        this.fullName = parentPath == null ? name : parentPath + PATH_SEPARATOR + name;
        Map<String, Integer> seen = new HashMap<>();
        for (Node<B> child : children) {
            if (!child.isSealed()) {
                int occurrence = seen.merge(child.getName(), 1, Integer::sum);
                if (occurrence > 1) {
                    child.name = child.getName() + "-" + occurrence;
                }
            }
            child.seal(fullName);
        }
        sealed = true;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new TreeProgrammingException(
                    "Tree containing " + getFullName() + " is already built");
        }
    }

    /// Opens this node's span under the context's current tracer.
    ///
    /// @param context the running context, not null
    /// @return the attached span, never null
    public final TraceNode openTrace(ExecutionContext context) {
        return context.getTracer().openChild(name, kind, getFullName());
    }

    /// Runs this node and returns its result.
    ///
    /// @param context the running context, not null
    /// @return the result, never null
    /// @throws TreeProgrammingException on structural defects detected while running
    /// @throws NodeCancelledException if the running task is cancelled
    public final Result execute(ExecutionContext context) {
        return execute(context, openTrace(context));
    }

    /// Runs this node under a span that was already opened for it.
    ///
    /// @param context the running context, not null
    /// @param trace span returned by {@link #openTrace(ExecutionContext)}, not null
    /// @return the result, never null
    public final Result execute(ExecutionContext context, TraceNode trace) {
        TraceNode previous = context.getTracer();
        context.setTracer(trace);
        Result result = null;
        try {
            if (context.isCancelled()) {
                throw new NodeCancelledException("Cancelled before start: " + getFullName());
            }
            result = doExecute(context, trace);
            if (result == null) {
                throw new TreeProgrammingException(kind + " '" + getFullName() + "' returned no result");
            }
        } catch (TreeProgrammingException | NodeCancelledException e) {
            throw e;
        } catch (InterruptedException e) {
            throw NodeCancelledException.interrupted(getFullName(), e);
        } catch (Exception | AssertionError e) {
            logger.warning(
                    kind + " '" + getFullName() + "' failed: " + e.getClass().getName() + ": "
                            + e.getMessage());
            trace.setAttribute("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            result = Result.fail();
        } finally {
            trace.finish(result);
            context.setTracer(previous);
            if (result != null) {
                context.setLastResult(result);
            }
        }
        return result;
    }

    /// Node-specific behaviour.
    ///
    /// @param context the running context, not null
    /// @param trace this invocation's span, already current on the context, not null
    /// @return the result, never null
    /// @throws Exception any failure; converted according to the failure policy
    protected abstract Result doExecute(ExecutionContext context, TraceNode trace)
            throws Exception;

    /// Returns the blackboard bound to the context, typed for this tree.
    protected final B blackboard(ExecutionContext context) {
        return context.getBlackboard();
    }

    @Override
    public String toString() {
        return kind + "(" + getFullName() + ")";
    }
}
