package io.tasktree.core.llm;

/// Resolves the API key for a model call from the blackboard.
@FunctionalInterface
public interface ApiKeyFactory {

    /// @param blackboard the current blackboard
    /// @return the key, may be null
    String apiKey(Object blackboard) throws Exception;
}
