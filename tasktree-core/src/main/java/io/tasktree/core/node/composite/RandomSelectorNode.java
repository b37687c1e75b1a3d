package io.tasktree.core.node.composite;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.util.WeightedShuffle;
import java.util.ArrayList;
import java.util.List;

/// A selector visiting its children in a weighted random order drawn from the
/// context's random source on every run.
///
/// @param <B> blackboard type
/// @see WeightedShuffle
public class RandomSelectorNode<B> extends SelectorNode<B> {

    private final double[] weights;

    /// @param weights one weight per child, or null for uniform weights
    public RandomSelectorNode(double[] weights) {
        super(NodeKinds.RANDOM_SELECTOR);
        this.weights = weights == null ? null : weights.clone();
    }

    @Override
    protected void validate() {
        if (weights == null) {
            return;
        }
        if (weights.length != childCount()) {
            throw new TreeProgrammingException(
                    "RandomSelector '"
                            + getName()
                            + "' has "
                            + weights.length
                            + " weights for "
                            + childCount()
                            + " children");
        }
        for (double weight : weights) {
            if (weight < 0 || !Double.isFinite(weight)) {
                throw new TreeProgrammingException(
                        "RandomSelector '" + getName() + "' has invalid weight " + weight);
            }
        }
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) {
        double[] effective = weights != null ? weights : WeightedShuffle.uniform(childCount());
        List<Integer> order = WeightedShuffle.order(effective, context.getRandom());
        trace.setAttribute("order", order);
        List<Node<B>> ordered = new ArrayList<>(order.size());
        for (int index : order) {
            ordered.add(child(index));
        }
        return selectFirstOk(context, ordered);
    }
}
