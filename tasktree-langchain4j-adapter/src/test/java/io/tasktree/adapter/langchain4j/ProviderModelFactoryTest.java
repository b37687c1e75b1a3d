package io.tasktree.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderModelFactoryTest {

    private final ProviderModelFactory factory =
            new ProviderModelFactory(Map.of("OPENAI_API_KEY", "sk-env"), Duration.ofSeconds(5));

    @Test
    void shouldRecognizeProviderPrefixes() {
        assertThat(factory.supportsModel("claude-sonnet-4")).isTrue();
        assertThat(factory.supportsModel("openrouter/openai/gpt-4.1-mini")).isTrue();
        assertThat(factory.supportsModel("deepseek-chat")).isTrue();
        assertThat(factory.supportsModel("llama3")).isFalse();
        assertThat(factory.supportsModel(null)).isFalse();
    }

    @Test
    void shouldStripProviderPath() {
        assertThat(ProviderModelFactory.stripProvider("openrouter/openai/gpt-4.1-mini")).isEqualTo("gpt-4.1-mini");
        assertThat(ProviderModelFactory.stripProvider("gpt-4o")).isEqualTo("gpt-4o");
    }

    @Test
    void shouldCreateOpenAiModelsWithCredentialKey() {
        assertThat(factory.chatModel("gpt-4o-mini", null)).isInstanceOf(OpenAiChatModel.class);
        assertThat(factory.streamingModel("gpt-4o-mini", null)).isInstanceOf(OpenAiStreamingChatModel.class);
    }

    @Test
    void shouldPreferCallKeyOverCredentials() {
        assertThat(factory.chatModel("claude-sonnet-4", "sk-call")).isInstanceOf(AnthropicChatModel.class);
        assertThat(factory.streamingModel("claude-sonnet-4", "sk-call"))
                .isInstanceOf(AnthropicStreamingChatModel.class);
    }

    @Test
    void shouldFailWithoutAnyKey() {
        assertThatThrownBy(() -> factory.chatModel("claude-sonnet-4", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ANTHROPIC_API_KEY");
    }

    @Test
    void shouldRejectUnknownModel() {
        assertThatThrownBy(() -> factory.chatModel("llama3", "key"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported model");
    }
}
