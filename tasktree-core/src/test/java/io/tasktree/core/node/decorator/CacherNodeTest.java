package io.tasktree.core.node.decorator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.tasktree.core.GlobalDefaults;
import io.tasktree.core.cache.CacheSettings;
import io.tasktree.core.cache.InMemoryKeyValueStore;
import io.tasktree.core.cache.KeyValueStore;
import io.tasktree.core.cache.MutableClock;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CacherNodeTest {

    /// No properties, so Jackson refuses to serialize it.
    static class Opaque {}

    static class Query {
        String user = "ada";
        int version = 1;
    }

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final AtomicInteger computations = new AtomicInteger();

    @AfterEach
    void resetDefaults() {
        GlobalDefaults.reset();
    }

    private Tree<Query> cachedTree(CacheSettings<Query> settings) {
        return Tree.<Query>builder("T")
                .cacher(settings)
                .function(q -> Map.of("user", q.user, "n", computations.incrementAndGet()))
                .build();
    }

    private ExecutionContext context() {
        return ExecutionContext.builder().keyValueStore(store).build();
    }

    @Test
    void shouldServeSecondRunFromCache() {
        // Given
        Tree<Query> tree = cachedTree(CacheSettings.<Query>builder().key(q -> "user:" + q.user).build());
        ExecutionContext second = context();

        // When
        Result first = tree.run(new Query(), context());
        Result cached = tree.run(new Query(), second);

        // Then
        assertThat(first).isEqualTo(Result.ok(Map.of("user", "ada", "n", 1)));
        assertThat(cached).isEqualTo(first);
        assertThat(computations).hasValue(1);
        assertThat(Traces.find(second.getTraceRoot(), "T/Cacher").getAttribute("cache"))
                .isEqualTo("hit");
        assertThat(store.get("user:ada")).isPresent();
    }

    @Test
    void shouldRecomputeWhenValidatorChanges() {
        // Given
        Tree<Query> tree =
                cachedTree(
                        CacheSettings.<Query>builder()
                                .key(q -> q.user)
                                .validator(q -> q.version)
                                .build());
        Query query = new Query();
        tree.run(query, context());
        query.version = 2;
        ExecutionContext context = context();

        // When
        Result result = tree.run(query, context);

        // Then
        assertThat(result.getDataAs(Map.class)).containsEntry("n", 2);
        assertThat(Traces.find(context.getTraceRoot(), "T/Cacher").getAttribute("cache"))
                .isEqualTo("stale");
    }

    @Test
    void shouldRecomputeAfterExpiration() {
        // Given
        Tree<Query> tree =
                cachedTree(
                        CacheSettings.<Query>builder()
                                .key(q -> q.user)
                                .expiration(Duration.ofMinutes(5))
                                .build());
        tree.run(new Query(), context());

        // When
        clock.advance(Duration.ofMinutes(5));
        tree.run(new Query(), context());

        // Then
        assertThat(computations).hasValue(2);
    }

    @Test
    void shouldNotCacheFailures() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        Tree<Query> tree =
                Tree.<Query>builder("T")
                        .cacher(CacheSettings.<Query>builder().key(q -> q.user).store(store).build())
                        .function(() -> Result.fail(calls.incrementAndGet()))
                        .build();

        // When
        tree.run(new Query());
        tree.run(new Query());

        // Then
        assertThat(calls).hasValue(2);
        assertThat(store.exists("ada")).isFalse();
    }

    @Test
    void shouldTreatUnreadableEntryAsMiss() {
        // Given
        store.set("ada", "not json", null);
        Tree<Query> tree = cachedTree(CacheSettings.<Query>builder().key(q -> q.user).build());

        // When
        Result result = tree.run(new Query(), context());

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(computations).hasValue(1);
    }

    @Test
    void shouldDecodeIntoConfiguredType() {
        // Given
        Tree<Query> tree =
                Tree.<Query>builder("T")
                        .cacher(
                                CacheSettings.<Query>builder()
                                        .key(q -> q.user)
                                        .dataType(Long.class)
                                        .build())
                        .function(() -> 1L)
                        .build();
        tree.run(new Query(), context());

        // When
        Result cached = tree.run(new Query(), context());

        // Then
        assertThat(cached.getData()).isEqualTo(1L);
    }

    @Test
    void shouldReturnChildResultWhenDataCannotBeEncoded() {
        // Given
        Opaque opaque = new Opaque();
        Tree<Query> tree =
                Tree.<Query>builder("T")
                        .cacher(CacheSettings.<Query>builder().key(q -> q.user).build())
                        .function(() -> opaque)
                        .build();
        ExecutionContext context = context();

        // When
        Result result = tree.run(new Query(), context);

        // Then
        assertThat(result).isEqualTo(Result.ok(opaque));
        assertThat(store.exists("ada")).isFalse();
        assertThat(Traces.find(context.getTraceRoot(), "T/Cacher").getAttribute("cache_write_error"))
                .asString()
                .startsWith("IllegalArgumentException");
    }

    @Test
    void shouldReturnChildResultWhenStoreWriteFails() {
        // Given
        KeyValueStore failing = mock(KeyValueStore.class);
        when(failing.get(anyString())).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("connection refused"))
                .when(failing)
                .set(anyString(), anyString(), any());
        Tree<Query> tree = cachedTree(CacheSettings.<Query>builder().key(q -> q.user).store(failing).build());
        ExecutionContext context = context();

        // When
        Result result = tree.run(new Query(), context);

        // Then
        assertThat(result).isEqualTo(Result.ok(Map.of("user", "ada", "n", 1)));
        assertThat(Traces.find(context.getTraceRoot(), "T/Cacher").getAttribute("cache_write_error"))
                .isEqualTo("IllegalStateException: connection refused");
    }

    @Test
    void shouldRaiseWithoutStore() {
        // Given
        GlobalDefaults.reset();
        Tree<Query> tree = cachedTree(CacheSettings.<Query>builder().key(q -> q.user).build());

        // When/Then
        assertThatThrownBy(() -> tree.run(new Query()))
                .isInstanceOf(TreeProgrammingException.class)
                .hasMessageContaining("no key-value store");
    }
}
