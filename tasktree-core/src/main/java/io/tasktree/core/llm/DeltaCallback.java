package io.tasktree.core.llm;

/// Receives streamed output of an {@link LlmNode}.
///
/// Called once per chunk with `finished == false`, then once more with the
/// full text, an empty delta and `finished == true`.
///
/// @param <B> blackboard type
@FunctionalInterface
public interface DeltaCallback<B> {

    /// @param blackboard the current blackboard
    /// @param full text received so far, never null
    /// @param delta text added by this chunk, never null
    /// @param finished `true` only for the final call
    /// @param finishReason finish reason reported so far, empty if none yet
    void onDelta(B blackboard, String full, String delta, boolean finished, String finishReason)
            throws Exception;
}
