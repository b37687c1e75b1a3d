package io.tasktree.core.node.composite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.execution.SpawnedTaskHook;
import io.tasktree.core.execution.SpawnedTaskHooks;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParallelNodeTest {

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
    void shouldRunChildrenConcurrentlyAndKeepChildOrder() {
        // Given
        CountDownLatch allStarted = new CountDownLatch(2);
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .parallel()
                        .function(
                                () -> {
                                    allStarted.countDown();
                                    allStarted.await(5, TimeUnit.SECONDS);
                                    return "a";
                                })
                        .function(
                                () -> {
                                    allStarted.countDown();
                                    allStarted.await(5, TimeUnit.SECONDS);
                                    return "b";
                                })
                        .end()
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result).isEqualTo(Result.ok(List.of("a", "b")));
        assertThat(allStarted.getCount()).isZero();
    }

    @Test
    void shouldFailWithNullAtFailedPositionsWithoutCancellingSiblings() {
        // Given
        AtomicInteger finished = new AtomicInteger();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .parallel()
                        .failure()
                        .function(
                                () -> {
                                    TimeUnit.MILLISECONDS.sleep(50);
                                    return finished.incrementAndGet();
                                })
                        .end()
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result).isEqualTo(Result.fail(Arrays.asList(null, 1)));
        assertThat(finished).hasValue(1);
    }

    @Test
    void shouldRespectConcurrencyLimit() {
        // Given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .parallel(2)
                        .function(() -> track(running, peak))
                        .function(() -> track(running, peak))
                        .function(() -> track(running, peak))
                        .function(() -> track(running, peak))
                        .end()
                        .build();

        // When
        Result result = tree.run(null);

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void shouldFireHookOncePerChild() {
        // Given
        List<Result> seen = new CopyOnWriteArrayList<>();
        SpawnedTaskHooks.register((context, trace, result) -> seen.add(result));
        Tree<Void> tree =
                Tree.<Void>builder("T").parallel().constant(1).failure().end().build();

        // When
        tree.run(null);

        // Then
        assertThat(seen).containsExactlyInAnyOrder(Result.ok(1), Result.fail());
    }

    @Test
    void shouldTraceChildrenUnderParallelSpan() {
        // Given
        Tree<Void> tree =
                Tree.<Void>builder("T").parallel().constant(1).constant(2).end().build();
        ExecutionContext context = ExecutionContext.create();

        // When
        tree.run(null, context);

        // Then
        TraceNode parallel = Traces.find(context.getTraceRoot(), "T/Parallel");
        assertThat(parallel.getChildren())
                .containsOnlyKeys("T/Parallel/Constant", "T/Parallel/Constant-2");
    }

    @Test
    void shouldRethrowProgrammingErrorAfterAllChildrenFinish() {
        // Given
        AtomicInteger finished = new AtomicInteger();
        Tree<Void> tree =
                Tree.<Void>builder("T")
                        .parallel()
                        .function(
                                () -> {
                                    throw new TreeProgrammingException("defect");
                                })
                        .function(
                                () -> {
                                    TimeUnit.MILLISECONDS.sleep(50);
                                    return finished.incrementAndGet();
                                })
                        .end()
                        .build();

        // When/Then
        assertThatThrownBy(() -> tree.run(null))
                .isInstanceOf(TreeProgrammingException.class)
                .hasMessage("defect");
        assertThat(finished).hasValue(1);
    }

    private static int track(AtomicInteger running, AtomicInteger peak) throws InterruptedException {
        int now = running.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        TimeUnit.MILLISECONDS.sleep(20);
        running.decrementAndGet();
        return now;
    }
}
