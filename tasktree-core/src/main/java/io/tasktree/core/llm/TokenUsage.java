package io.tasktree.core.llm;

import java.util.LinkedHashMap;
import java.util.Map;

/// Token counts reported for one model call.
public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0);
    }

    /// @return `{prompt, completion, total}` as recorded on trace spans, never null
    public Map<String, Integer> toAttribute() {
        Map<String, Integer> tokens = new LinkedHashMap<>();
        tokens.put("prompt", promptTokens);
        tokens.put("completion", completionTokens);
        tokens.put("total", totalTokens);
        return tokens;
    }
}
