package io.tasktree.core.llm;

/// Complete response of a model call.
///
/// @param text response text, never null
/// @param finishReason finish reason, empty if unknown
/// @param usage token counts, never null
/// @param cost call cost in the provider's currency, `0` if unknown
public record ChatCompletion(String text, String finishReason, TokenUsage usage, double cost) {

    public ChatCompletion {
        text = text == null ? "" : text;
        finishReason = finishReason == null ? "" : finishReason;
        usage = usage == null ? TokenUsage.empty() : usage;
    }
}
