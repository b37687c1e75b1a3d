package io.tasktree.core.node.decorator;

import static org.assertj.core.api.Assertions.assertThat;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WrapperAndSubtreeTest {

    static class Outer {
        final Map<String, Object> inner = new HashMap<>();
        String name = "outer";
    }

    @Test
    void shouldReturnChildResultFromAroundWrapper() {
        // Given
        List<String> events = new ArrayList<>();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .wrapper(
                                (child, board) -> {
                                    events.add("before");
                                    try {
                                        return child.call();
                                    } finally {
                                        events.add("after");
                                    }
                                })
                        .function(() -> events.add("body") ? "ok" : "unreachable")
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result).isEqualTo(Result.ok("ok"));
        assertThat(events).containsExactly("before", "body", "after");
    }

    @Test
    void shouldLetWrapperRunChildMoreThanOnce() {
        // Given
        AtomicInteger runs = new AtomicInteger();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .wrapper(
                                (child, board) -> {
                                    Result first = child.call();
                                    return first.isOk() ? child.call() : first;
                                })
                        .function(() -> runs.incrementAndGet())
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result).isEqualTo(Result.ok(2));
        assertThat(runs).hasValue(2);
    }

    @Test
    void shouldRunTeardownWhenChildRaises() {
        // Given
        List<String> events = new ArrayList<>();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .wrapper(
                                (child, board) -> {
                                    try {
                                        return child.call();
                                    } finally {
                                        events.add("after");
                                    }
                                })
                        .function(
                                () -> {
                                    throw new IllegalStateException("body failed");
                                })
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result).isEqualTo(Result.fail());
        assertThat(events).containsExactly("after");
    }

    @Test
    void shouldFailWhenWrapperReturnsNoResult() {
        // Given
        List<String> events = new ArrayList<>();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .wrapper((child, board) -> null)
                        .function(() -> events.add("body"))
                        .build();
        ExecutionContext context = ExecutionContext.create();

        // When
        Result result = tree.run(null, context);

        // Then
        assertThat(result).isEqualTo(Result.fail());
        assertThat(events).isEmpty();
        assertThat(Traces.find(context.getTraceRoot(), "T/Wrapper").getAttribute("error"))
                .isEqualTo("no result");
    }

    @Test
    void shouldFailWhenWrapperRaises() {
        // Given
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .wrapper(
                                (child, board) -> {
                                    throw new UnsupportedOperationException("not a wrapper");
                                })
                        .constant("ok")
                        .build();

        // When/Then
        assertThat(tree.run(null)).isEqualTo(Result.fail());
    }

    @Test
    void shouldRunSubtreeAgainstDerivedBlackboard() {
        // Given
        Tree<Map<String, Object>> inner =
                Tree.<Map<String, Object>>builder("Inner")
                        .sequence()
                        .constant("written")
                        .writeBlackboard("value")
                        .end()
                        .build();
        Tree<Outer> outer =
                Tree.<Outer>builder("Outer")
                        .sequence()
                        .subtree(inner, o -> o.inner)
                        .function(o -> o.name)
                        .end()
                        .build();
        Outer board = new Outer();
        ExecutionContext context = ExecutionContext.create();

        // When
        Result result = outer.run(board, context);

        // Then
        assertThat(result).isEqualTo(Result.ok("outer"));
        assertThat(board.inner).containsEntry("value", "written");
        assertThat(Traces.find(context.getTraceRoot(), "Inner/Sequence")).isNotNull();
    }

    @Test
    void shouldShareBlackboardWithoutFactory() {
        // Given
        Tree<Map<String, Object>> inner =
                Tree.<Map<String, Object>>builder("Inner")
                        .function(b -> b.put("seen", true))
                        .build();
        Tree<Map<String, Object>> outer =
                Tree.<Map<String, Object>>builder("Outer").subtree(inner).build();
        Map<String, Object> board = new HashMap<>();

        // When
        outer.run(board);

        // Then
        assertThat(board).containsEntry("seen", true);
    }
}
