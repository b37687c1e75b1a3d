package io.tasktree.core.json;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JsonRepairTest {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "{\"a\": 1|{\"a\": 1}",
                "{\"a\": [1, 2|{\"a\": [1, 2]}",
                "{\"a\": \"unterminated|{\"a\": \"unterminated\"}",
                "{\"a\":|{\"a\":null}",
                "[1, 2,|[1, 2]",
                "Sure! Here it is: {\"ok\": true}|{\"ok\": true}",
                "{\"a\": 1}}|{\"a\": 1}"
            })
    void shouldRepairTruncatedOrNoisyJson(String broken, String expected) {
        assertThat(JsonRepair.repair(broken)).isEqualTo(expected);
    }

    @Test
    void shouldLeaveBracesInsideStringsAlone() {
        assertThat(JsonRepair.repair("{\"text\": \"a } b")).isEqualTo("{\"text\": \"a } b\"}");
    }

    @Test
    void shouldStripCodeFence() {
        assertThat(CodeFences.strip("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(CodeFences.strip("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
        assertThat(CodeFences.strip("```\n[1]")).isEqualTo("[1]");
    }
}
