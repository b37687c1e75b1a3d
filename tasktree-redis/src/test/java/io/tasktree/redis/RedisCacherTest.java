package io.tasktree.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import io.tasktree.core.cache.CacheSettings;
import io.tasktree.core.node.decorator.TerminableSettings;
import io.tasktree.core.result.Result;
import io.tasktree.core.tree.Tree;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

@ExtendWith(MockitoExtension.class)
class RedisCacherTest {

    static class Board {
        String question;

        Board(String question) {
            this.question = question;
        }
    }

    @Mock private JedisPool pool;

    @Mock private Jedis jedis;

    @Test
    void shouldBuildNamespacedSettings() {
        // Given
        JedisKeyValueStore store = new JedisKeyValueStore(pool);

        // When
        CacheSettings<Board> settings = RedisCacher.settings(store, b -> b.question, Duration.ofMinutes(1));

        // Then
        assertThat(settings.getStore()).isSameAs(store);
        assertThat(settings.getPrefix()).isEqualTo(RedisCacher.KEY_PREFIX);
        assertThat(settings.getExpiration()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void shouldBuildTerminableSettings() {
        // Given
        JedisKeyValueStore store = new JedisKeyValueStore(pool);

        // When
        TerminableSettings<Board> settings = RedisCacher.terminable(store, b -> "cancel:" + b.question);

        // Then
        assertThat(settings.getStore()).isSameAs(store);
        assertThat(settings.getMonitorInterval()).isEqualTo(TerminableSettings.DEFAULT_MONITOR_INTERVAL);
    }

    @Test
    void shouldServeSecondRunFromRedis() {
        // Given
        Map<String, String> redis = new HashMap<>();
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.get(anyString())).thenAnswer(call -> redis.get(call.<String>getArgument(0)));
        when(jedis.psetex(anyString(), anyLong(), anyString()))
                .thenAnswer(
                        call -> {
                            redis.put(call.getArgument(0), call.getArgument(2));
                            return "OK";
                        });
        AtomicInteger calls = new AtomicInteger();
        Tree<Board> tree =
                Tree.<Board>builder("Answer")
                        .cacher(RedisCacher.settings(new JedisKeyValueStore(pool), b -> b.question, Duration.ofMinutes(1)))
                        .function(
                                b -> {
                                    calls.incrementAndGet();
                                    return "forty-two";
                                })
                        .end()
                        .build();

        // When
        Result first = tree.run(new Board("meaning"));
        Result second = tree.run(new Board("meaning"));

        // Then
        assertThat(first).isEqualTo(Result.ok("forty-two"));
        assertThat(second).isEqualTo(Result.ok("forty-two"));
        assertThat(calls).hasValue(1);
        assertThat(redis).containsOnlyKeys(RedisCacher.KEY_PREFIX + "meaning");
    }
}
