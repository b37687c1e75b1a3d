package io.tasktree.core.node;

/// A node without children.
///
/// @param <B> blackboard type
public abstract class LeafNode<B> extends Node<B> {

    protected LeafNode(String kind) {
        super(kind);
    }

    @Override
    public final int maxChildren() {
        return 0;
    }
}
