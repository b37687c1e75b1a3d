package io.tasktree.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BlackboardsTest {

    static class Bean {
        private String topic = "java";
        private boolean done;
        private int writes;

        public String getTopic() {
            return topic;
        }

        public boolean isDone() {
            return done;
        }

        public void setTopic(String topic) {
            this.topic = topic;
            writes++;
        }
    }

    static class Fields {
        private Object answer;
        private final String fixed = "fixed";
    }

    record Query(String text) {}

    @Test
    void shouldUseMapEntries() {
        // Given
        Map<String, Object> board = new HashMap<>();

        // When
        Blackboards.write(board, "x", 1);

        // Then
        assertThat(Blackboards.read(board, "x")).isEqualTo(1);
        assertThat(Blackboards.read(board, "missing")).isNull();
    }

    @Test
    void shouldPreferAccessorsOverFields() {
        // Given
        Bean bean = new Bean();

        // When
        Blackboards.write(bean, "topic", "trees");

        // Then
        assertThat(Blackboards.read(bean, "topic")).isEqualTo("trees");
        assertThat(Blackboards.read(bean, "done")).isEqualTo(false);
        assertThat(bean.writes).isEqualTo(1);
    }

    @Test
    void shouldFallBackToPrivateFields() {
        // Given
        Fields board = new Fields();

        // When
        Blackboards.write(board, "answer", 42);

        // Then
        assertThat(board.answer).isEqualTo(42);
        assertThat(Blackboards.read(board, "fixed")).isEqualTo("fixed");
    }

    @Test
    void shouldReadRecordComponents() {
        assertThat(Blackboards.read(new Query("why"), "text")).isEqualTo("why");
    }

    @Test
    void shouldRejectUnknownOrFinalAttributes() {
        // Given
        Fields board = new Fields();

        // When/Then
        assertThatThrownBy(() -> Blackboards.read(board, "nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> Blackboards.write(board, "fixed", "other"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No writable attribute");
    }
}
