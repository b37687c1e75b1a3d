package io.tasktree.core.node.decorator;

import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.exception.NodeCancelledException;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTask;
import io.tasktree.core.node.DecoratorNode;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Runs its primary child as a spawned task while polling an external
/// termination signal.
///
/// The signal is the presence of a key (derived once from the blackboard) in a
/// {@link KeyValueStore}. When it appears before the child finishes, the child
/// is cancelled and awaited, then the optional {@link FallbackNode} runs; without
/// one the node returns `FAIL(null)`. The spawned-task hooks fire once for the
/// primary child.
///
/// @param <B> blackboard type
/// @see TerminableSettings
public class TerminableNode<B> extends DecoratorNode<B> {

    private static final Logger logger = Logger.getLogger(TerminableNode.class.getName());

    private final TerminableSettings<B> settings;

    public TerminableNode(TerminableSettings<B> settings) {
        super(NodeKinds.TERMINABLE);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public int maxChildren() {
        return 2;
    }

    @Override
    protected void checkChild(Node<B> child, int position) {
        super.checkChild(child, position);
        if (position == 0 && child instanceof FallbackNode) {
            throw new TreeProgrammingException(
                    "Fallback must follow the primary child of Terminable '" + getName() + "'");
        }
        if (position == 1 && !(child instanceof FallbackNode)) {
            throw new TreeProgrammingException(
                    "The second child of Terminable '"
                            + getName()
                            + "' must be Fallback, got "
                            + child.getKind());
        }
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        KeyValueStore store = settings.getStore() != null ? settings.getStore() : context.getKeyValueStore();
        if (store == null) {
            throw new TreeProgrammingException(
                    "Terminable '" + getFullName() + "' has no key-value store configured");
        }
        String key = String.valueOf(settings.getKey().apply(blackboard(context)));
        trace.setAttribute("signal_key", key);

        SpawnedTask task = SpawnedTask.spawn(primary(), context.fork(), null, true);
        try {
            while (true) {
                try {
                    Result result = task.await(settings.getMonitorInterval());
                    trace.setAttribute("terminated", false);
                    return result;
                } catch (TimeoutException e) {
                    if (store.exists(key)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            task.cancelAndAwait();
            throw NodeCancelledException.interrupted(getFullName(), e);
        } catch (RuntimeException e) {
            task.cancelAndAwait();
            throw e;
        }

        task.cancelAndAwait();
        trace.setAttribute("terminated", true);
        logger.info("Terminated by signal " + key + ": " + getFullName());
        if (childCount() > 1) {
            return child(1).execute(context);
        }
        return Result.fail();
    }
}
