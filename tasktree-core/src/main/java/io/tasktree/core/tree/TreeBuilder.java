package io.tasktree.core.tree;

import io.tasktree.core.cache.CacheSettings;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.function.BlackboardFunction;
import io.tasktree.core.function.BlackboardPredicate;
import io.tasktree.core.function.BlackboardSetter;
import io.tasktree.core.function.Functions;
import io.tasktree.core.function.TaskCondition;
import io.tasktree.core.function.TaskSupplier;
import io.tasktree.core.function.TracedFunction;
import io.tasktree.core.llm.ChatMessage;
import io.tasktree.core.llm.LlmNode;
import io.tasktree.core.llm.LlmSettings;
import io.tasktree.core.node.Node;
import io.tasktree.core.node.composite.GatherNode;
import io.tasktree.core.node.composite.GatherPlan;
import io.tasktree.core.node.composite.ParallelNode;
import io.tasktree.core.node.composite.RandomSelectorNode;
import io.tasktree.core.node.composite.SelectorNode;
import io.tasktree.core.node.composite.SequenceNode;
import io.tasktree.core.node.composite.WhileNode;
import io.tasktree.core.node.decorator.CacherNode;
import io.tasktree.core.node.decorator.ElseNode;
import io.tasktree.core.node.decorator.FallbackNode;
import io.tasktree.core.node.decorator.ForceFailNode;
import io.tasktree.core.node.decorator.ForceOkNode;
import io.tasktree.core.node.decorator.IfNode;
import io.tasktree.core.node.decorator.InvertNode;
import io.tasktree.core.node.decorator.NodeWrapper;
import io.tasktree.core.node.decorator.RetryNode;
import io.tasktree.core.node.decorator.ReturnNode;
import io.tasktree.core.node.decorator.SubtreeNode;
import io.tasktree.core.node.decorator.TerminableNode;
import io.tasktree.core.node.decorator.TerminableSettings;
import io.tasktree.core.node.decorator.TimeoutNode;
import io.tasktree.core.node.decorator.WrapperNode;
import io.tasktree.core.node.leaf.AssertNode;
import io.tasktree.core.node.leaf.ConstantNode;
import io.tasktree.core.node.leaf.FailureNode;
import io.tasktree.core.node.leaf.FunctionNode;
import io.tasktree.core.node.leaf.LogNode;
import io.tasktree.core.node.leaf.ParseJsonNode;
import io.tasktree.core.node.leaf.ParseJsonSettings;
import io.tasktree.core.node.leaf.WriteBlackboardNode;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;

/// Fluent, cursor-based construction of a {@link Tree}.
///
/// The builder keeps a stack of open nodes; the top is the insertion point.
/// Attaching a leaf adds it to the insertion point. Attaching a node that takes
/// children (composite or decorator) adds it and makes it the insertion point
/// until {@link #end()} closes it. {@link #build()} closes whatever is still
/// open and validates the whole tree.
///
/// {@snippet :
/// Tree<Board> tree = Tree.<Board>builder("Fetch")
///         .sequence()
///             .timeout(Duration.ofSeconds(2))
///                 .function(b -> fetch(b.url))
///                 .fallback()
///                     .constant("[timed out]")
///                 .end()
///             .end()
///             .writeBlackboard("body")
///         .end()
///         .build();
/// }
///
/// ### Build-time errors
/// Every structural mistake raises {@link TreeProgrammingException} from the
/// offending call or from `build()`: attaching to a full node, `Else` or
/// `Fallback` in the wrong place, a non-positive limit, a missing child,
/// closing more levels than are open.
///
/// ### Custom node kinds
/// {@link #attach(Node)} inserts any {@link Node} subclass through the same
/// cursor mechanics as the built-in kinds.
///
/// @param <B> blackboard type
public final class TreeBuilder<B> {

    private final Tree<B> tree;
    private final Deque<Node<B>> open = new ArrayDeque<>();
    private String pendingName;
    private boolean built;

    TreeBuilder(Tree<B> tree) {
        this.tree = tree;
        this.open.push(tree);
    }

    /// Names the next attached node. Without a name a node is named after its kind.
    ///
    /// @param name display name, not blank
    /// @return this builder for chaining, never null
    public TreeBuilder<B> named(String name) {
        this.pendingName = name;
        return this;
    }

    /// Attaches a node at the insertion point. Nodes that take children become
    /// the new insertion point.
    ///
    /// @param node node to attach, not null
    /// @return this builder for chaining, never null
    /// @throws TreeProgrammingException if the insertion point cannot take the node
    public TreeBuilder<B> attach(Node<B> node) {
        Objects.requireNonNull(node, "node must not be null");
        return attach(node, node.maxChildren() > 0);
    }

    private TreeBuilder<B> attach(Node<B> node, boolean opens) {
        checkNotBuilt();
        if (pendingName != null) {
            node.setName(pendingName);
            pendingName = null;
        }
        open.peek().addChild(node);
        if (opens) {
            open.push(node);
        }
        return this;
    }

    /// Closes the current insertion point and returns to its parent.
    ///
    /// @return this builder for chaining, never null
    /// @throws TreeProgrammingException if no node is open
    public TreeBuilder<B> end() {
        checkNotBuilt();
        if (open.size() <= 1) {
            throw new TreeProgrammingException("end() called with no open node in tree " + tree.getName());
        }
        open.pop();
        return this;
    }

    /// Closes all open nodes, validates the tree and freezes it.
    ///
    /// @return the built tree, never null
    /// @throws TreeProgrammingException on structural errors
    public Tree<B> build() {
        checkNotBuilt();
        if (pendingName != null) {
            throw new TreeProgrammingException("named(\"" + pendingName + "\") is not followed by a node");
        }
        built = true;
        open.clear();
        tree.seal(null);
        return tree;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new TreeProgrammingException("Tree " + tree.getName() + " is already built");
        }
    }

    // Leaves

    public TreeBuilder<B> function(TaskSupplier<?> function) {
        return attach(new FunctionNode<>(Functions.traced(function)));
    }

    public TreeBuilder<B> function(BlackboardFunction<B, ?> function) {
        return attach(new FunctionNode<>(Functions.traced(function)));
    }

    public TreeBuilder<B> function(TracedFunction<B, ?> function) {
        return attach(new FunctionNode<>(function));
    }

    public TreeBuilder<B> assertion(TaskCondition condition) {
        return attach(new AssertNode<>(Functions.predicate(condition)));
    }

    public TreeBuilder<B> assertion(BlackboardPredicate<B> predicate) {
        return attach(new AssertNode<>(predicate));
    }

    /// Writes the previous result's data to an attribute.
    public TreeBuilder<B> writeBlackboard(String attribute) {
        return attach(new WriteBlackboardNode<>(Functions.setter(attribute)), false);
    }

    /// Writes the previous result's data through a setter.
    public TreeBuilder<B> writeBlackboard(BlackboardSetter<B> setter) {
        return attach(new WriteBlackboardNode<>(setter), false);
    }

    /// Opens a write-blackboard scope that writes the data of its single child.
    public TreeBuilder<B> writeBlackboardFrom(String attribute) {
        return attach(new WriteBlackboardNode<>(Functions.setter(attribute)));
    }

    /// Opens a write-blackboard scope that writes the data of its single child.
    public TreeBuilder<B> writeBlackboardFrom(BlackboardSetter<B> setter) {
        return attach(new WriteBlackboardNode<>(setter));
    }

    /// Parses the previous result's data as JSON.
    public TreeBuilder<B> parseJson() {
        return attach(new ParseJsonNode<>(ParseJsonSettings.defaults()));
    }

    /// Parses the previous result's data as JSON and writes the value to an attribute.
    public TreeBuilder<B> parseJson(String destination) {
        return attach(new ParseJsonNode<>(ParseJsonSettings.<B>builder().destination(destination).build()));
    }

    public TreeBuilder<B> parseJson(ParseJsonSettings<B> settings) {
        return attach(new ParseJsonNode<>(settings));
    }

    public TreeBuilder<B> log(String message) {
        Objects.requireNonNull(message, "message must not be null");
        return attach(new LogNode<B>(b -> message, Level.INFO));
    }

    public TreeBuilder<B> log(BlackboardFunction<B, ?> message) {
        return attach(new LogNode<>(message, Level.INFO));
    }

    public TreeBuilder<B> log(BlackboardFunction<B, ?> message, Level level) {
        return attach(new LogNode<>(message, level));
    }

    public TreeBuilder<B> failure() {
        return attach(new FailureNode<>());
    }

    public TreeBuilder<B> constant(Object value) {
        return attach(new ConstantNode<>(value));
    }

    public TreeBuilder<B> llm(String model, BlackboardFunction<B, List<ChatMessage>> messages) {
        return attach(new LlmNode<>(LlmSettings.<B>builder().model(model).messages(messages).build()));
    }

    public TreeBuilder<B> llm(LlmSettings<B> settings) {
        return attach(new LlmNode<>(settings));
    }

    public <C> TreeBuilder<B> subtree(Tree<C> subtree) {
        return subtreeOf(subtree, null);
    }

    public <C> TreeBuilder<B> subtree(Tree<C> subtree, BlackboardFunction<B, C> blackboardFactory) {
        Objects.requireNonNull(blackboardFactory, "blackboardFactory must not be null");
        return subtreeOf(subtree, blackboardFactory);
    }

    private <C> TreeBuilder<B> subtreeOf(Tree<C> subtree, BlackboardFunction<B, C> factory) {
        Objects.requireNonNull(subtree, "subtree must not be null");
        if (!subtree.isSealed()) {
            throw new TreeProgrammingException("Subtree " + subtree.getName() + " must be built first");
        }
        // Without a factory the subtree runs against this tree's blackboard.
        return attach(new SubtreeNode<>(subtree, factory));
    }

    // Composites

    public TreeBuilder<B> sequence() {
        return attach(new SequenceNode<>());
    }

    public TreeBuilder<B> selector() {
        return attach(new SelectorNode<>());
    }

    /// Opens a random selector with uniform weights, or one weight per child.
    public TreeBuilder<B> randomSelector(double... weights) {
        return attach(new RandomSelectorNode<>(weights == null || weights.length == 0 ? null : Arrays.copyOf(weights, weights.length)));
    }

    public TreeBuilder<B> parallel() {
        return attach(new ParallelNode<>(null));
    }

    public TreeBuilder<B> parallel(int concurrencyLimit) {
        return attach(new ParallelNode<>(concurrencyLimit));
    }

    public <C> TreeBuilder<B> gather(BlackboardFunction<B, GatherPlan<C>> factory) {
        return attach(new GatherNode<>(factory, null));
    }

    public <C> TreeBuilder<B> gather(BlackboardFunction<B, GatherPlan<C>> factory, int concurrencyLimit) {
        return attach(new GatherNode<>(factory, concurrencyLimit));
    }

    public TreeBuilder<B> whileLoop(BlackboardPredicate<B> condition) {
        return attach(new WhileNode<>(condition, null));
    }

    public TreeBuilder<B> whileLoop(BlackboardPredicate<B> condition, int maxLoopTimes) {
        return attach(new WhileNode<>(condition, maxLoopTimes));
    }

    // Decorators

    public TreeBuilder<B> ifThen(String attribute) {
        return attach(new IfNode<>(Functions.predicate(attribute)));
    }

    public TreeBuilder<B> ifThen(TaskCondition condition) {
        return attach(new IfNode<>(Functions.predicate(condition)));
    }

    public TreeBuilder<B> ifThen(BlackboardPredicate<B> condition) {
        return attach(new IfNode<>(condition));
    }

    /// Opens the else-branch. Legal only right after closing an If's then-branch.
    public TreeBuilder<B> orElse() {
        return attach(new ElseNode<>());
    }

    public TreeBuilder<B> invert() {
        return attach(new InvertNode<>());
    }

    public TreeBuilder<B> forceOk() {
        return attach(new ForceOkNode<>(null));
    }

    public TreeBuilder<B> forceOk(BlackboardFunction<B, ?> dataFactory) {
        return attach(new ForceOkNode<>(Objects.requireNonNull(dataFactory, "dataFactory must not be null")));
    }

    public TreeBuilder<B> forceFail() {
        return attach(new ForceFailNode<>(null));
    }

    public TreeBuilder<B> forceFail(BlackboardFunction<B, ?> dataFactory) {
        return attach(new ForceFailNode<>(Objects.requireNonNull(dataFactory, "dataFactory must not be null")));
    }

    /// Opens a Return decorator replacing the child's data.
    public TreeBuilder<B> returning(BlackboardFunction<B, ?> dataFactory) {
        return attach(new ReturnNode<>(dataFactory));
    }

    public TreeBuilder<B> retry(int maxTries) {
        return attach(new RetryNode<>(maxTries, List.of()));
    }

    /// Opens a Retry decorator. The pauses apply to successive gaps; the last
    /// one repeats once they run out.
    public TreeBuilder<B> retry(int maxTries, Duration... sleeps) {
        return attach(new RetryNode<>(maxTries, Arrays.asList(sleeps)));
    }

    public TreeBuilder<B> retry(int maxTries, List<Duration> sleeps) {
        return attach(new RetryNode<>(maxTries, sleeps));
    }

    public TreeBuilder<B> timeout(Duration timeout) {
        return attach(new TimeoutNode<>(timeout));
    }

    public TreeBuilder<B> terminable(BlackboardFunction<B, ?> signalKey) {
        return attach(new TerminableNode<>(TerminableSettings.<B>builder().key(signalKey).build()));
    }

    public TreeBuilder<B> terminable(TerminableSettings<B> settings) {
        return attach(new TerminableNode<>(settings));
    }

    /// Opens the fallback branch of a Terminable or Timeout.
    public TreeBuilder<B> fallback() {
        return attach(new FallbackNode<>());
    }

    public TreeBuilder<B> wrapper(NodeWrapper<B> wrapper) {
        return attach(new WrapperNode<>(wrapper));
    }

    public TreeBuilder<B> cacher(CacheSettings<B> settings) {
        return attach(new CacherNode<>(settings));
    }
}
