package io.tasktree.core.node.decorator;

import static org.assertj.core.api.Assertions.assertThat;

import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTaskHook;
import io.tasktree.core.execution.SpawnedTaskHooks;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeoutNodeTest {

    private List<SpawnedTaskHook> savedHooks;

    @BeforeEach
    void saveHooks() {
        savedHooks = SpawnedTaskHooks.snapshot();
        SpawnedTaskHooks.clear();
    }

    @AfterEach
    void restoreHooks() {
        SpawnedTaskHooks.restore(savedHooks);
    }

    @Test
    void shouldPassResultThroughWhenOnTime() {
        // Given
        Tree<Void> tree =
                Tree.<Void>builder("T").timeout(Duration.ofSeconds(5)).constant("fast").build();
        ExecutionContext context = ExecutionContext.create();

        // When
        Result result = tree.run(null, context);

        // Then
        assertThat(result).isEqualTo(Result.ok("fast"));
        assertThat(Traces.find(context.getTraceRoot(), "T/Timeout").getAttribute("timed_out"))
                .isEqualTo(false);
    }

    @Test
    void shouldCancelChildAndRunFallbackOnExpiry() {
        // Given
        AtomicBoolean cleanedUp = new AtomicBoolean();
        AtomicBoolean completed = new AtomicBoolean();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .timeout(Duration.ofMillis(50))
                        .function(
                                () -> {
                                    try {
                                        TimeUnit.SECONDS.sleep(10);
                                        completed.set(true);
                                        return "slow";
                                    } finally {
                                        cleanedUp.set(true);
                                    }
                                })
                        .fallback()
                        .constant("fallback")
                        .build();
        ExecutionContext context = ExecutionContext.create();

        // When
        Result result = tree.run(null, context);

        // Then
        assertThat(result).isEqualTo(Result.ok("fallback"));
        assertThat(cleanedUp).isTrue();
        assertThat(completed).isFalse();
        assertThat(Traces.find(context.getTraceRoot(), "T/Timeout").getAttribute("timed_out"))
                .isEqualTo(true);
    }

    @Test
    void shouldFailWithoutFallbackOnExpiry() {
        // Given
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .timeout(Duration.ofMillis(20))
                        .function(
                                () -> {
                                    TimeUnit.SECONDS.sleep(10);
                                    return "slow";
                                })
                        .build();

        // When/Then
        assertThat(tree.run(null)).isEqualTo(Result.fail());
    }

    @Test
    void shouldNotFireSpawnedTaskHooks() {
        // Given
        AtomicInteger fired = new AtomicInteger();
        SpawnedTaskHooks.register((context, trace, result) -> fired.incrementAndGet());
        Tree<Void> tree =
                Tree.<Void>builder("T").timeout(Duration.ofSeconds(1)).constant(1).build();

        // When
        tree.run(null);

        // Then
        assertThat(fired).hasValue(0);
    }
}
