package io.tasktree.core.node;

/// A node with any number of children and an aggregation policy.
///
/// @param <B> blackboard type
public abstract class CompositeNode<B> extends Node<B> {

    protected CompositeNode(String kind) {
        super(kind);
    }

    @Override
    public int maxChildren() {
        return Integer.MAX_VALUE;
    }
}
