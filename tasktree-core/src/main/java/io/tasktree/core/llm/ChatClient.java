package io.tasktree.core.llm;

import java.util.function.Consumer;

/// Provider-neutral access to chat models.
///
/// Implementations live in adapter modules; {@link StubChatClient} serves tests
/// and offline runs.
public interface ChatClient {

    /// Performs a blocking model call.
    ///
    /// @param request the call, not null
    /// @return the response, never null
    /// @throws Exception if the provider call fails
    ChatCompletion complete(ChatRequest request) throws Exception;

    /// Performs a streaming model call, handing every chunk to `onChunk` as it
    /// arrives, and returns the aggregated response.
    ///
    /// The default implementation calls {@link #complete(ChatRequest)} and
    /// emits the whole text as one chunk.
    ///
    /// @param request the call, not null
    /// @param onChunk chunk consumer, not null
    /// @return the aggregated response, never null
    /// @throws Exception if the provider call or the consumer fails
    default ChatCompletion stream(ChatRequest request, Consumer<ChatChunk> onChunk)
            throws Exception {
        ChatCompletion completion = complete(request);
        onChunk.accept(new ChatChunk(completion.text(), completion.finishReason()));
        return completion;
    }
}
