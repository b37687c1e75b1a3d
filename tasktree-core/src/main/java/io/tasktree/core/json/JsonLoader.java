package io.tasktree.core.json;

/// Parses JSON text into plain Java values (maps, lists, strings, numbers,
/// booleans, null).
///
/// @see JacksonJsonLoader
@FunctionalInterface
public interface JsonLoader {

    /// @param text the text to parse, not null
    /// @return the parsed value, may be null for a JSON `null`
    /// @throws Exception if the text cannot be parsed
    Object load(String text) throws Exception;
}
