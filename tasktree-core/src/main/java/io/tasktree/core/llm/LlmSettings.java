package io.tasktree.core.llm;

import io.tasktree.core.function.BlackboardFunction;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Configuration of an {@link LlmNode}.
///
/// ### Fields
/// - `model`, `messages`: required
/// - `apiKey`: fixed key; null resolves through {@link io.tasktree.core.GlobalDefaults}
/// - `client`: null resolves through the run's context, then the global default
/// - `stream`: stream the response; implied by an `onDelta` callback
/// - `options`: provider options passed through unchanged
///
/// @param <B> blackboard type
public final class LlmSettings<B> {

    private final String model;
    private final BlackboardFunction<B, List<ChatMessage>> messages;
    private final String apiKey;
    private final ChatClient client;
    private final boolean stream;
    private final DeltaCallback<B> onDelta;
    private final Map<String, Object> options;

    private LlmSettings(Builder<B> builder) {
        this.model = builder.model;
        this.messages = builder.messages;
        this.apiKey = builder.apiKey;
        this.client = builder.client;
        this.stream = builder.stream || builder.onDelta != null;
        this.onDelta = builder.onDelta;
        this.options = Map.copyOf(builder.options);
    }

    public String getModel() {
        return model;
    }

    public BlackboardFunction<B, List<ChatMessage>> getMessages() {
        return messages;
    }

    public String getApiKey() {
        return apiKey;
    }

    public ChatClient getClient() {
        return client;
    }

    public boolean isStream() {
        return stream;
    }

    public DeltaCallback<B> getOnDelta() {
        return onDelta;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public static <B> Builder<B> builder() {
        return new Builder<>();
    }

    public static final class Builder<B> {
        private String model;
        private BlackboardFunction<B, List<ChatMessage>> messages;
        private String apiKey;
        private ChatClient client;
        private boolean stream;
        private DeltaCallback<B> onDelta;
        private final Map<String, Object> options = new LinkedHashMap<>();

        private Builder() {}

        public Builder<B> model(String model) {
            this.model = model;
            return this;
        }

        public Builder<B> messages(BlackboardFunction<B, List<ChatMessage>> messages) {
            this.messages = messages;
            return this;
        }

        public Builder<B> apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder<B> client(ChatClient client) {
            this.client = client;
            return this;
        }

        public Builder<B> stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder<B> onDelta(DeltaCallback<B> onDelta) {
            this.onDelta = onDelta;
            return this;
        }

        public Builder<B> option(String name, Object value) {
            this.options.put(name, value);
            return this;
        }

        /// @return the settings, never null
        /// @throws IllegalStateException if model or messages are missing
        public LlmSettings<B> build() {
            if (model == null || model.isBlank()) {
                throw new IllegalStateException("LLM model is required");
            }
            if (messages == null) {
                throw new IllegalStateException("LLM messages factory is required");
            }
            return new LlmSettings<>(this);
        }
    }
}
