package io.tasktree.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceSerializerTest {

    private static TraceNode sampleTrace() {
        TraceNode root = TraceNode.root();
        TraceNode tree = root.openChild("Summarize", "Tree", "Summarize");
        TraceNode llm = tree.openChild("LLM", "LLM", "Summarize/LLM");
        llm.setAttribute("model", "gpt-4o-mini");
        llm.setAttribute("tokens", Map.of("prompt", 10, "completion", 5, "total", 15));
        llm.addCost(0.25);
        llm.log("calling model");
        llm.finish(Result.ok("short"));
        TraceNode retry = tree.openChild("LLM", "LLM", "Summarize/LLM");
        retry.addCost(0.5);
        retry.finish(Result.fail());
        tree.finish(Result.ok("short"));
        root.finish(Result.ok("short"));
        return root;
    }

    @Test
    void shouldWriteRecordShapeWithIsoTimestamps() {
        // Given
        TraceNode root = sampleTrace();

        // When
        String json = TraceSerializer.toJson(root);

        // Then
        assertThat(json)
                .contains("\"name\" : \"ROOT\"")
                .contains("\"fullname\" : \"Summarize/LLM\"")
                .contains("\"start_at\" : \"" + root.getStartAt() + "\"")
                .contains("\"status\" : \"FAIL\"");
    }

    @Test
    void shouldReadTypedRecord() {
        // Given
        TraceNode root = sampleTrace();

        // When
        TraceRecord record = TraceSerializer.fromJson(TraceSerializer.toJson(root));

        // Then
        assertThat(record.kind()).isEqualTo(TraceNode.ROOT);
        assertThat(record.startAt()).isEqualTo(root.getStartAt());
        assertThat(record.finished()).isTrue();
        assertThat(record.totalCost()).isEqualTo(0.75);

        TraceRecord tree = record.children().get(0);
        assertThat(tree.children()).extracting(TraceRecord::status).containsExactly("OK", "FAIL");

        TraceRecord llm = record.find("Summarize/LLM").orElseThrow();
        assertThat(llm.logs()).containsExactly("calling model");
        assertThat(llm.result()).isEqualTo("OK(short)");
        assertThat(llm.attributes()).containsEntry("model", "gpt-4o-mini");
    }

    @Test
    void shouldKeepUnfinishedSpansReadable() {
        // Given
        TraceNode root = TraceNode.root();
        root.openChild("Slow", "Function", "T/Slow");

        // When
        TraceRecord record = TraceSerializer.fromJson(TraceSerializer.toJson(root));

        // Then
        TraceRecord slow = record.find("T/Slow").orElseThrow();
        assertThat(slow.finished()).isFalse();
        assertThat(slow.endAt()).isNull();
        assertThat(slow.status()).isNull();
    }

    @Test
    void shouldIgnoreUnknownFields() {
        // Given
        String json =
                "{\"name\":\"ROOT\",\"kind\":\"ROOT\",\"fullname\":\"ROOT\",\"viewer_hint\":1,"
                        + "\"children\":[]}";

        // When
        TraceRecord record = TraceSerializer.fromJson(json);

        // Then
        assertThat(record.name()).isEqualTo("ROOT");
        assertThat(record.children()).isEmpty();
        assertThat(record.logs()).isEmpty();
    }

    @Test
    void shouldReadPlainRecord() {
        // When
        Map<String, Object> record = TraceSerializer.recordFromJson(TraceSerializer.toJson(sampleTrace()));

        // Then
        assertThat(record).containsEntry("kind", "ROOT");
        assertThat(record.get("children")).isInstanceOf(List.class);
    }

    @Test
    void shouldWrapMalformedJson() {
        assertThatThrownBy(() -> TraceSerializer.fromJson("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize trace");
    }
}
