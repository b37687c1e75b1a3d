package io.tasktree.adapter.langchain4j;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;

/// Creates LangChain4j models for a model name and API key.
///
/// @see ProviderModelFactory
public interface ModelFactory {

    /// @param modelName model identifier as given to the LLM node, not null
    /// @param apiKey key resolved for the call, may be null to use the factory's credentials
    /// @return a blocking model, never null
    /// @throws IllegalArgumentException if the model is not supported
    ChatModel chatModel(String modelName, String apiKey);

    /// @param modelName model identifier as given to the LLM node, not null
    /// @param apiKey key resolved for the call, may be null to use the factory's credentials
    /// @return a streaming model, never null
    /// @throws IllegalArgumentException if the model is not supported
    StreamingChatModel streamingModel(String modelName, String apiKey);
}
