package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Emits a message to the log and to the trace, then returns `OK(null)`.
///
/// @param <B> blackboard type
public class LogNode<B> extends LeafNode<B> {

    private static final Logger logger = Logger.getLogger(LogNode.class.getName());

    private final BlackboardFunction<B, ?> message;
    private final Level level;

    public LogNode(BlackboardFunction<B, ?> message, Level level) {
        super(NodeKinds.LOG);
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        String text = String.valueOf(message.apply(blackboard(context)));
        logger.log(level, "[" + getFullName() + "] " + text);
        trace.log(text);
        return Result.ok();
    }
}
