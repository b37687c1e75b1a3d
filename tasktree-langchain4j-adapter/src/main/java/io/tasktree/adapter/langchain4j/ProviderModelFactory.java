package io.tasktree.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link ModelFactory} choosing the provider from the model name prefix.
///
/// | Prefix | Provider | Credential keys |
/// |--------|----------|-----------------|
/// | `claude` | Anthropic | `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1`, `o3`, `o4` | OpenAI | `OPENAI_API_KEY` |
/// | `deepseek` | DeepSeek (OpenAI-compatible API) | `DEEPSEEK_API_KEY` |
///
/// A provider prefix such as `openai/` is stripped before routing. An API key
/// passed with the call takes precedence over the credentials map.
///
/// @implNote Stateless and thread-safe. Each call builds a new model instance;
/// {@link LangChain4jChatClient} caches them.
public class ProviderModelFactory implements ModelFactory {

    private static final Logger logger = Logger.getLogger(ProviderModelFactory.class.getName());

    private static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private final Map<String, String> credentials;
    private final Duration timeout;

    /// Uses the process environment as credentials and a 60 second timeout.
    public ProviderModelFactory() {
        this(System.getenv(), Duration.ofSeconds(60));
    }

    /// @param credentials API keys by credential key name, not null
    /// @param timeout request timeout, not null
    public ProviderModelFactory(Map<String, String> credentials, Duration timeout) {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// @param modelName model identifier, may be null
    /// @return `true` if a provider is known for the name
    public boolean supportsModel(String modelName) {
        return modelName != null && provider(modelName) != null;
    }

    @Override
    public ChatModel chatModel(String modelName, String apiKey) {
        String name = stripProvider(modelName);
        Provider provider = requireProvider(modelName);
        logger.info("Creating " + provider + " chat model: " + name);
        String key = resolveKey(provider, apiKey);
        if (provider == Provider.ANTHROPIC) {
            return AnthropicChatModel.builder().apiKey(key).modelName(name).timeout(timeout).build();
        }
        var builder = OpenAiChatModel.builder().apiKey(key).modelName(name).timeout(timeout);
        if (provider == Provider.DEEPSEEK) {
            builder.baseUrl(DEEPSEEK_BASE_URL);
        }
        return builder.build();
    }

    @Override
    public StreamingChatModel streamingModel(String modelName, String apiKey) {
        String name = stripProvider(modelName);
        Provider provider = requireProvider(modelName);
        logger.info("Creating " + provider + " streaming model: " + name);
        String key = resolveKey(provider, apiKey);
        if (provider == Provider.ANTHROPIC) {
            return AnthropicStreamingChatModel.builder().apiKey(key).modelName(name).timeout(timeout).build();
        }
        var builder = OpenAiStreamingChatModel.builder().apiKey(key).modelName(name).timeout(timeout);
        if (provider == Provider.DEEPSEEK) {
            builder.baseUrl(DEEPSEEK_BASE_URL);
        }
        return builder.build();
    }

    private enum Provider {
        ANTHROPIC("ANTHROPIC_API_KEY"),
        OPENAI("OPENAI_API_KEY"),
        DEEPSEEK("DEEPSEEK_API_KEY");

        private final String credentialKey;

        Provider(String credentialKey) {
            this.credentialKey = credentialKey;
        }
    }

    private static Provider provider(String modelName) {
        String name = stripProvider(modelName);
        if (name.startsWith("claude")) {
            return Provider.ANTHROPIC;
        } else if (name.startsWith("gpt")
                || name.startsWith("o1")
                || name.startsWith("o3")
                || name.startsWith("o4")) {
            return Provider.OPENAI;
        } else if (name.startsWith("deepseek")) {
            return Provider.DEEPSEEK;
        }
        return null;
    }

    private static Provider requireProvider(String modelName) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        Provider provider = provider(modelName);
        if (provider == null) {
            throw new IllegalArgumentException("Unsupported model: " + modelName);
        }
        return provider;
    }

    static String stripProvider(String modelName) {
        int slash = modelName.lastIndexOf('/');
        return slash < 0 ? modelName : modelName.substring(slash + 1);
    }

    /// @throws IllegalStateException if neither the call nor the credentials carry a key
    private String resolveKey(Provider provider, String apiKey) {
        if (apiKey != null && !apiKey.isEmpty()) {
            return apiKey;
        }
        String value = credentials.get(provider.credentialKey);
        if (value == null || value.isEmpty()) {
            throw new IllegalStateException(
                    "API key not found. Provide one with the call or set " + provider.credentialKey);
        }
        return value;
    }
}
