package io.tasktree.core.node.composite;

import io.tasktree.core.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// The subtrees a `Gather` runs and the blackboard each runs against, paired
/// by position.
///
/// The two lists are not checked against each other here: a length mismatch is
/// raised by the gather node when it runs.
///
/// @param trees subtrees to run, not null
/// @param blackboards one derived blackboard per subtree, not null, may contain nulls
/// @param <C> blackboard type of the subtrees
public record GatherPlan<C>(List<Node<C>> trees, List<C> blackboards) {

    public GatherPlan {
        Objects.requireNonNull(trees, "trees must not be null");
        Objects.requireNonNull(blackboards, "blackboards must not be null");
        trees = List.copyOf(trees);
        blackboards = Collections.unmodifiableList(new ArrayList<>(blackboards));
    }

    public static <C> GatherPlan<C> of(List<? extends Node<C>> trees, List<? extends C> blackboards) {
        return new GatherPlan<>(new ArrayList<>(trees), new ArrayList<>(blackboards));
    }
}
