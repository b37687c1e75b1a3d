package io.tasktree.core.node.leaf;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.json.CodeFences;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.logging.Logger;

/// Parses JSON text and optionally writes the value onto the blackboard.
///
/// Code fences are stripped before parsing. On success the node writes the
/// value to the destination and returns `OK(value)`. When the loader gives up,
/// the node returns `FAIL(text)` with the original text and writes nothing.
/// Non-string sources are converted with `String.valueOf`; a null source fails.
///
/// @param <B> blackboard type
/// @see ParseJsonSettings
public class ParseJsonNode<B> extends LeafNode<B> {

    private static final Logger logger = Logger.getLogger(ParseJsonNode.class.getName());

    private final ParseJsonSettings<B> settings;

    public ParseJsonNode(ParseJsonSettings<B> settings) {
        super(NodeKinds.PARSE_JSON);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        B blackboard = blackboard(context);
        Object source;
        if (settings.getSource() != null) {
            source = settings.getSource().apply(blackboard);
        } else {
            Result previous = context.getLastResult();
            source = previous != null ? previous.getData() : null;
        }
        if (source == null) {
            trace.setAttribute("error", "no source text");
            return Result.fail();
        }
        String text = String.valueOf(source);
        Object parsed;
        try {
            parsed = settings.getLoader().load(CodeFences.strip(text));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.info("Unparseable JSON at " + getFullName() + ": " + e.getMessage());
            trace.setAttribute("error", e.getClass().getSimpleName() + ": " + e.getMessage());
            return Result.fail(text);
        }
        if (settings.getDestination() != null) {
            settings.getDestination().set(blackboard, parsed);
        }
        return Result.ok(parsed);
    }
}
