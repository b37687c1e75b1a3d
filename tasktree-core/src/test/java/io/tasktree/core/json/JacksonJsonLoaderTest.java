package io.tasktree.core.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonJsonLoaderTest {

    private final JacksonJsonLoader loader = new JacksonJsonLoader();

    @Test
    void shouldParseStrictJson() throws Exception {
        assertThat(loader.load("{\"name\": \"Ada\", \"tags\": [\"x\"]}"))
                .isEqualTo(Map.of("name", "Ada", "tags", List.of("x")));
    }

    @Test
    void shouldParseTruncatedJsonAfterRepair() throws Exception {
        assertThat(loader.load("{\"name\": \"Ada\", \"tags\": [\"x\", \"y\""))
                .isEqualTo(Map.of("name", "Ada", "tags", List.of("x", "y")));
    }

    @Test
    void shouldAcceptRelaxedSyntax() throws Exception {
        assertThat(loader.load("{name: 'Ada', count: 2,}"))
                .isEqualTo(Map.of("name", "Ada", "count", 2));
    }

    @Test
    void shouldRejectPlainProse() {
        assertThatThrownBy(() -> loader.load("no json here"))
                .isInstanceOf(JsonProcessingException.class);
    }
}
