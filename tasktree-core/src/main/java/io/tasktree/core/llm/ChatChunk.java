package io.tasktree.core.llm;

/// One streamed piece of a response.
///
/// @param delta text added by this chunk, never null
/// @param finishReason finish reason, empty until the provider reports one
public record ChatChunk(String delta, String finishReason) {

    public ChatChunk {
        delta = delta == null ? "" : delta;
        finishReason = finishReason == null ? "" : finishReason;
    }
}
