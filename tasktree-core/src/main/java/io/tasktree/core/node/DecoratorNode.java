package io.tasktree.core.node;

/// A node wrapping exactly one primary child. Kinds that accept an auxiliary
/// child (a fallback, an else branch) raise {@link #maxChildren()}.
///
/// @param <B> blackboard type
public abstract class DecoratorNode<B> extends Node<B> {

    protected DecoratorNode(String kind) {
        super(kind);
    }

    @Override
    public int maxChildren() {
        return 1;
    }

    @Override
    public int minChildren() {
        return 1;
    }

    /// @return the wrapped child, never null once the tree is built
    protected final Node<B> primary() {
        return child(0);
    }
}
