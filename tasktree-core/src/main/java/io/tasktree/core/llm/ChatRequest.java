package io.tasktree.core.llm;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A model call as issued by an {@link LlmNode}.
///
/// @param model model identifier, not null
/// @param messages conversation, not null
/// @param apiKey resolved API key, may be null
/// @param options provider-specific options such as `temperature`, not null
public record ChatRequest(
        String model, List<ChatMessage> messages, String apiKey, Map<String, Object> options) {

    public ChatRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = List.copyOf(messages);
        options = Map.copyOf(options);
    }
}
