package io.tasktree.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.tasktree.core.cache.InMemoryKeyValueStore;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.llm.StubChatClient;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.trace.TraceStorage;
import io.tasktree.core.tree.Tree;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskTreeEnvironmentTest {

    @Mock private TraceStorage traceStorage;

    @Mock private ExecutorService mockExecutor;

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @AfterEach
    void resetDefaults() {
        GlobalDefaults.reset();
    }

    @Test
    void shouldWireContextsToEnvironment() {
        // Given
        StubChatClient client = new StubChatClient();
        TaskTreeEnvironment env =
                new TaskTreeEnvironment(
                        new TaskTreeConfig(), mockExecutor, store, traceStorage, client, null);

        // When
        ExecutionContext context = env.newContext();

        // Then
        assertThat(context.getExecutorService()).isSameAs(mockExecutor);
        assertThat(context.getKeyValueStore()).isSameAs(store);
        assertThat(context.getChatClient()).isSameAs(client);
    }

    @Test
    void shouldShareSeededRandomAcrossContexts() {
        // Given
        TaskTreeEnvironment env =
                new TaskTreeEnvironment(
                        TaskTreeConfig.builder().randomSeed(1).build(),
                        mockExecutor,
                        store,
                        traceStorage,
                        null,
                        null);

        // When/Then
        assertThat(env.newContext().getRandom()).isSameAs(env.newContext().getRandom());
    }

    @Test
    void shouldRunTreeAndSaveTrace() {
        // Given
        when(traceStorage.save(any())).thenReturn("trace-1");
        ExecutorService executor = Executors.newCachedThreadPool();
        Tree<Void> tree = Tree.<Void>builder("T").parallel().constant(1).constant(2).end().build();

        // When
        TracedRun run;
        try (TaskTreeEnvironment env =
                new TaskTreeEnvironment(new TaskTreeConfig(), executor, store, traceStorage, null, null)) {
            run = env.run(tree, null);
        }

        // Then
        assertThat(run.result().isOk()).isTrue();
        assertThat(run.traceId()).isEqualTo("trace-1");
        assertThat(run.trace().getKind()).isEqualTo(TraceNode.ROOT);
        assertThat(run.trace().getChildren()).containsOnlyKeys("T");
        verify(traceStorage).save(run.trace());
        assertThat(executor.isShutdown()).isTrue();
    }

    @Test
    void shouldInstallAsProcessDefaults() {
        // Given
        StubChatClient client = new StubChatClient();
        TaskTreeEnvironment env =
                new TaskTreeEnvironment(
                        new TaskTreeConfig(), mockExecutor, store, traceStorage, client, board -> "k");

        // When
        env.installAsDefaults();

        // Then
        assertThat(GlobalDefaults.getKeyValueStore()).isSameAs(store);
        assertThat(GlobalDefaults.getChatClient()).isSameAs(client);
        assertThat(GlobalDefaults.getExecutorService()).isSameAs(mockExecutor);
        assertThat(GlobalDefaults.getApiKeyFactory()).isNotNull();
    }

    @Test
    void shouldShutdownExecutorOnClose() throws Exception {
        // Given
        when(mockExecutor.awaitTermination(5, TimeUnit.SECONDS)).thenReturn(true);
        TaskTreeEnvironment env =
                new TaskTreeEnvironment(new TaskTreeConfig(), mockExecutor, store, traceStorage, null, null);

        // When
        env.close();

        // Then
        verify(mockExecutor).shutdown();
    }

    @Test
    void shouldReturnResultOfTrivialTree() {
        // Given
        when(traceStorage.save(any())).thenReturn("id");
        TaskTreeEnvironment env =
                new TaskTreeEnvironment(new TaskTreeConfig(), mockExecutor, store, traceStorage, null, null);

        // When
        TracedRun run = env.run(Tree.<Void>builder("T").constant("x").build(), null);

        // Then
        assertThat(run.result()).isEqualTo(Result.ok("x"));
    }
}
