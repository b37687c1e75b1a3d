package io.tasktree.core.node.composite;

import static org.assertj.core.api.Assertions.assertThat;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import org.junit.jupiter.api.Test;

class WhileNodeTest {

    static class Counter {
        int value;
    }

    @Test
    void shouldLoopUntilConditionTurnsFalse() {
        // Given
        Tree<Counter> tree =
                Tree.<Counter>builder("T").whileLoop(c -> c.value < 3).function(c -> ++c.value).build();
        Counter counter = new Counter();
        ExecutionContext context = ExecutionContext.create();

        // When
        Result result = tree.run(counter, context);

        // Then
        assertThat(result).isEqualTo(Result.ok(3));
        assertThat(Traces.find(context.getTraceRoot(), "T/While").getAttribute("loops")).isEqualTo(3);
    }

    @Test
    void shouldFailWhenBodyNeverRuns() {
        // Given
        Tree<Counter> tree =
                Tree.<Counter>builder("T").whileLoop(c -> false).function(c -> ++c.value).build();

        // When/Then
        assertThat(tree.run(new Counter())).isEqualTo(Result.fail());
    }

    @Test
    void shouldStopAtFailureAndReturnLastSuccess() {
        // Given
        Tree<Counter> tree =
                Tree.<Counter>builder("T")
                        .whileLoop(c -> true)
                        .function(c -> ++c.value < 3 ? Result.ok(c.value) : Result.fail("stop"))
                        .build();
        Counter counter = new Counter();

        // When
        Result result = tree.run(counter);

        // Then
        assertThat(result).isEqualTo(Result.ok(2));
        assertThat(counter.value).isEqualTo(3);
    }

    @Test
    void shouldStopAtMaxLoopTimes() {
        // Given
        Tree<Counter> tree =
                Tree.<Counter>builder("T").whileLoop(c -> true, 5).function(c -> ++c.value).build();
        Counter counter = new Counter();

        // When
        Result result = tree.run(counter);

        // Then
        assertThat(result).isEqualTo(Result.ok(5));
        assertThat(counter.value).isEqualTo(5);
    }
}
