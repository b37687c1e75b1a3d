package io.tasktree.core.llm;

import io.tasktree.core.GlobalDefaults;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.node.LeafNode;
import io.tasktree.core.node.NodeKinds;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Calls a chat model and returns `OK(text)`.
///
/// ### Resolution
/// - client: settings, then the run's context, then {@link GlobalDefaults}
/// - API key: settings, then the global {@link ApiKeyFactory}
///
/// ### Trace attributes
/// `model`, `api_key` (always masked as `***` when a key is used), `tokens`
/// (`{prompt, completion, total}`), `prompt_tokens`, `completion_tokens`,
/// `total_tokens` and `finish_reason`. The call cost is added to the span's cost.
///
/// @param <B> blackboard type
/// @see LlmSettings
public class LlmNode<B> extends LeafNode<B> {

    private static final Logger logger = Logger.getLogger(LlmNode.class.getName());

    private final LlmSettings<B> settings;

    public LlmNode(LlmSettings<B> settings) {
        super(NodeKinds.LLM);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    protected Result doExecute(ExecutionContext context, TraceNode trace) throws Exception {
        ChatClient client = settings.getClient() != null ? settings.getClient() : context.getChatClient();
        if (client == null) {
            throw new TreeProgrammingException(
                    "LLM '" + getFullName() + "' has no chat client configured");
        }
        B blackboard = blackboard(context);
        String apiKey = resolveApiKey(blackboard);
        List<ChatMessage> messages = settings.getMessages().apply(blackboard);
        ChatRequest request =
                new ChatRequest(settings.getModel(), messages, apiKey, settings.getOptions());
        trace.setAttribute("model", settings.getModel());
        if (apiKey != null) {
            trace.setAttribute("api_key", "***");
        }

        logger.fine("Calling model " + settings.getModel() + " from " + getFullName());
        ChatCompletion completion =
                settings.isStream() ? stream(client, request, blackboard) : client.complete(request);

        TokenUsage usage = completion.usage();
        trace.setAttribute("tokens", usage.toAttribute());
        trace.setAttribute("prompt_tokens", usage.promptTokens());
        trace.setAttribute("completion_tokens", usage.completionTokens());
        trace.setAttribute("total_tokens", usage.totalTokens());
        trace.setAttribute("finish_reason", completion.finishReason());
        trace.addCost(completion.cost());
        return Result.ok(completion.text());
    }

    private ChatCompletion stream(ChatClient client, ChatRequest request, B blackboard)
            throws Exception {
        DeltaCallback<B> onDelta = settings.getOnDelta();
        StringBuilder full = new StringBuilder();
        String[] reason = {""};
        ChatCompletion completion =
                client.stream(
                        request,
                        chunk -> {
                            full.append(chunk.delta());
                            if (!chunk.finishReason().isEmpty()) {
                                reason[0] = chunk.finishReason();
                            }
                            if (onDelta != null) {
                                emit(onDelta, blackboard, full.toString(), chunk.delta(), false, reason[0]);
                            }
                        });
        String finishReason = completion.finishReason().isEmpty() ? reason[0] : completion.finishReason();
        String text = full.length() > 0 ? full.toString() : completion.text();
        if (onDelta != null) {
            onDelta.onDelta(blackboard, text, "", true, finishReason);
        }
        return new ChatCompletion(text, finishReason, completion.usage(), completion.cost());
    }

    private static <B> void emit(
            DeltaCallback<B> onDelta,
            B blackboard,
            String full,
            String delta,
            boolean finished,
            String reason) {
        try {
            onDelta.onDelta(blackboard, full, delta, finished, reason);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Delta callback failed: " + e.getMessage(), e);
        }
    }

    private String resolveApiKey(B blackboard) throws Exception {
        if (settings.getApiKey() != null) {
            return settings.getApiKey();
        }
        ApiKeyFactory factory = GlobalDefaults.getApiKeyFactory();
        return factory != null ? factory.apiKey(blackboard) : null;
    }
}
