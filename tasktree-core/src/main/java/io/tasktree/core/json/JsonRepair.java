package io.tasktree.core.json;

import java.util.ArrayDeque;
import java.util.Deque;

/// Best-effort repair of truncated or sloppy JSON.
///
/// ### Repairs
/// - leading prose before the first `{` or `[` is dropped
/// - an unterminated string is closed
/// - a dangling `:` gets a `null` value, a dangling `,` is removed
/// - unclosed objects and arrays are closed in order
/// - closing brackets that match nothing are dropped
///
/// The output is meant for a lenient parser (single quotes, unquoted field
/// names and trailing commas allowed); it is not guaranteed to be valid JSON.
public final class JsonRepair {

    private JsonRepair() {}

    /// @param text the broken text, not null
    /// @return the repaired text, never null
    public static String repair(String text) {
        String input = dropLeadingProse(text.trim());
        StringBuilder out = new StringBuilder(input.length() + 8);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> {
                    inString = true;
                    out.append(c);
                }
                case '{' -> {
                    open.push('}');
                    out.append(c);
                }
                case '[' -> {
                    open.push(']');
                    out.append(c);
                }
                case '}', ']' -> {
                    if (!open.isEmpty() && open.peek() == c) {
                        open.pop();
                        out.append(c);
                    }
                }
                default -> out.append(c);
            }
        }
        if (inString) {
            if (escaped) {
                out.setLength(out.length() - 1);
            }
            out.append('"');
        }
        if (!open.isEmpty()) {
            trimTrailingWhitespace(out);
            if (endsWith(out, ':')) {
                out.append("null");
            } else if (endsWith(out, ',')) {
                out.setLength(out.length() - 1);
            }
            while (!open.isEmpty()) {
                out.append(open.pop());
            }
        }
        return out.toString();
    }

    private static String dropLeadingProse(String text) {
        if (text.isEmpty()) {
            return text;
        }
        char first = text.charAt(0);
        if (first == '{' || first == '[' || first == '"') {
            return text;
        }
        int object = text.indexOf('{');
        int array = text.indexOf('[');
        int start;
        if (object < 0) {
            start = array;
        } else if (array < 0) {
            start = object;
        } else {
            start = Math.min(object, array);
        }
        return start > 0 ? text.substring(start) : text;
    }

    private static void trimTrailingWhitespace(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        out.setLength(end);
    }

    private static boolean endsWith(StringBuilder out, char c) {
        return out.length() > 0 && out.charAt(out.length() - 1) == c;
    }
}
