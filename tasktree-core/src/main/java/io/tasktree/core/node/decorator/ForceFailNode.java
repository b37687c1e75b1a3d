package io.tasktree.core.node.decorator;

import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.ResultStatus;

/// Always `FAIL`, with the child's data or the factory's.
///
/// @param <B> blackboard type
public class ForceFailNode<B> extends ForceStatusNode<B> {

    /// @param dataFactory replacement data, or null to keep the child's
    public ForceFailNode(BlackboardFunction<B, ?> dataFactory) {
        super(NodeKinds.FORCE_FAIL, ResultStatus.FAIL, dataFactory);
    }
}
