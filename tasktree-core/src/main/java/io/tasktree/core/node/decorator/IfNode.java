package io.tasktree.core.node.decorator;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardPredicate;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;

/// Runs its first child if the condition holds, otherwise the child of its
/// optional {@link ElseNode} second child, otherwise returns `OK(null)`.
///
/// @param <B> blackboard type
public class IfNode<B> extends DecoratorNode<B> {

    private final BlackboardPredicate<B> condition;

    public IfNode(BlackboardPredicate<B> condition) {
        super(NodeKinds.IF);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public int maxChildren() {
        return 2;
    }

    @Override
    protected void checkChild(Node<B> child, int position) {
        super.checkChild(child, position);
        boolean isElse = child instanceof ElseNode;
        if (position == 0 && isElse) {
            throw new TreeProgrammingException(
                    "Else must follow the then-branch of If '" + getName() + "'");
        }
        if (position == 1 && !isElse) {
            throw new TreeProgrammingException(
                    "The second child of If '" + getName() + "' must be Else, got " + child.getKind());
        }
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        boolean holds = condition.test(blackboard(context));
        trace.setAttribute("condition", holds);
        if (holds) {
            return primary().execute(context);
        }
        if (childCount() > 1) {
            return child(1).execute(context);
        }
        return Result.ok();
    }
}
