package io.tasktree.core.json;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Extracts the body of a Markdown code fence, as language models like to wrap
/// JSON in ```` ```json ```` blocks.
public final class CodeFences {

    private static final Pattern FENCE =
            Pattern.compile("```[a-zA-Z0-9_+-]*[ \\t]*\\r?\\n?(.*?)(?:```|$)", Pattern.DOTALL);

    private CodeFences() {}

    /// Returns the content of the first fenced block, or the trimmed text if it
    /// has no fence. An unterminated fence runs to the end of the text.
    ///
    /// @param text the text, not null
    /// @return the unfenced text, never null
    public static String strip(String text) {
        Matcher matcher = FENCE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text.trim();
    }
}
