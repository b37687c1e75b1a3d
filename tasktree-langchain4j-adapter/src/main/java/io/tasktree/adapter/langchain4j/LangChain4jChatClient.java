package io.tasktree.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import io.tasktree.core.llm.ChatChunk;
import io.tasktree.core.llm.ChatClient;
import io.tasktree.core.llm.ChatCompletion;
import io.tasktree.core.llm.ChatRequest;
import io.tasktree.core.llm.TokenUsage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// {@link ChatClient} backed by LangChain4j chat models.
///
/// Models registered on the builder are used for their names regardless of the
/// call's API key. Other names are created through the {@link ModelFactory},
/// once per model and key.
///
/// ### Options
/// Call options map onto LangChain4j request parameters:
/// - `temperature` and `top_p` (numbers)
/// - `max_tokens` (integer)
/// - `stop` (list of strings)
///
/// Other options are ignored.
///
/// ### Cost
/// With a {@link ModelPricing} registered for the model, the completion cost is
/// computed from the reported token usage; otherwise it is `0`.
///
/// @implNote Thread-safe. A streaming call blocks the calling thread until the
/// provider completes; interrupting the thread abandons the call.
public class LangChain4jChatClient implements ChatClient {

    private static final Logger logger = Logger.getLogger(LangChain4jChatClient.class.getName());

    private final ModelFactory modelFactory;
    private final Map<String, ChatModel> chatModels;
    private final Map<String, StreamingChatModel> streamingModels;
    private final Map<String, ModelPricing> pricing;
    private final Map<String, ChatModel> createdChatModels = new ConcurrentHashMap<>();
    private final Map<String, StreamingChatModel> createdStreamingModels = new ConcurrentHashMap<>();

    private LangChain4jChatClient(Builder builder) {
        this.modelFactory = builder.modelFactory;
        this.chatModels = Map.copyOf(builder.chatModels);
        this.streamingModels = Map.copyOf(builder.streamingModels);
        this.pricing = Map.copyOf(builder.pricing);
    }

    @Override
    public ChatCompletion complete(ChatRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        ChatModel model = chatModel(request);
        logger.fine("Calling model " + request.model() + " with " + request.messages().size() + " messages");
        ChatResponse response = model.chat(toLangChain4j(request));
        if (response == null) {
            throw new IllegalStateException("No response from model " + request.model());
        }
        return toCompletion(request.model(), response.aiMessage().text(), response);
    }

    @Override
    public ChatCompletion stream(ChatRequest request, Consumer<ChatChunk> onChunk) throws Exception {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(onChunk, "onChunk must not be null");
        StreamingChatModel model = streamingModel(request);
        if (model == null) {
            return ChatClient.super.stream(request, onChunk);
        }
        CompletableFuture<ChatResponse> done = new CompletableFuture<>();
        StringBuilder text = new StringBuilder();
        model.chat(
                toLangChain4j(request),
                new StreamingChatResponseHandler() {
                    @Override
                    public void onPartialResponse(String partialResponse) {
                        if (done.isDone()) {
                            return;
                        }
                        try {
                            text.append(partialResponse);
                            onChunk.accept(new ChatChunk(partialResponse, ""));
                        } catch (RuntimeException e) {
                            done.completeExceptionally(e);
                        }
                    }

                    @Override
                    public void onCompleteResponse(ChatResponse completeResponse) {
                        done.complete(completeResponse);
                    }

                    @Override
                    public void onError(Throwable error) {
                        done.completeExceptionally(error);
                    }
                });
        ChatResponse response;
        try {
            response = done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
        String fullText =
                response.aiMessage() != null && response.aiMessage().text() != null
                        ? response.aiMessage().text()
                        : text.toString();
        ChatCompletion completion = toCompletion(request.model(), fullText, response);
        onChunk.accept(new ChatChunk("", completion.finishReason()));
        return completion;
    }

    private ChatModel chatModel(ChatRequest request) {
        ChatModel registered = chatModels.get(request.model());
        if (registered != null) {
            return registered;
        }
        if (modelFactory == null) {
            throw new IllegalArgumentException("No chat model registered for " + request.model());
        }
        return createdChatModels.computeIfAbsent(
                cacheKey(request), key -> modelFactory.chatModel(request.model(), request.apiKey()));
    }

    /// @return the streaming model, or null to fall back to a blocking call
    private StreamingChatModel streamingModel(ChatRequest request) {
        StreamingChatModel registered = streamingModels.get(request.model());
        if (registered != null) {
            return registered;
        }
        if (modelFactory == null || chatModels.containsKey(request.model())) {
            return null;
        }
        return createdStreamingModels.computeIfAbsent(
                cacheKey(request), key -> modelFactory.streamingModel(request.model(), request.apiKey()));
    }

    private static String cacheKey(ChatRequest request) {
        return request.model() + '\u0000' + (request.apiKey() == null ? "" : request.apiKey());
    }

    private dev.langchain4j.model.chat.request.ChatRequest toLangChain4j(ChatRequest request) {
        var builder = dev.langchain4j.model.chat.request.ChatRequest.builder().messages(toMessages(request));
        Map<String, Object> options = request.options();
        if (options.get("temperature") instanceof Number temperature) {
            builder.temperature(temperature.doubleValue());
        }
        if (options.get("top_p") instanceof Number topP) {
            builder.topP(topP.doubleValue());
        }
        if (options.get("max_tokens") instanceof Number maxTokens) {
            builder.maxOutputTokens(maxTokens.intValue());
        }
        if (options.get("stop") instanceof List<?> stop) {
            List<String> sequences = new ArrayList<>();
            stop.forEach(s -> sequences.add(String.valueOf(s)));
            builder.stopSequences(sequences);
        }
        return builder.build();
    }

    static List<ChatMessage> toMessages(ChatRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (io.tasktree.core.llm.ChatMessage message : request.messages()) {
            switch (message.role()) {
                case io.tasktree.core.llm.ChatMessage.SYSTEM:
                    messages.add(SystemMessage.from(message.content()));
                    break;
                case io.tasktree.core.llm.ChatMessage.ASSISTANT:
                    messages.add(AiMessage.from(message.content()));
                    break;
                case io.tasktree.core.llm.ChatMessage.USER:
                    messages.add(UserMessage.from(message.content()));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported message role: " + message.role());
            }
        }
        return messages;
    }

    private ChatCompletion toCompletion(String model, String text, ChatResponse response) {
        TokenUsage usage = toUsage(response.metadata().tokenUsage());
        ModelPricing price = pricing.get(model);
        double cost = price == null ? 0 : price.cost(usage.promptTokens(), usage.completionTokens());
        return new ChatCompletion(text, finishReason(response.metadata().finishReason()), usage, cost);
    }

    private static TokenUsage toUsage(dev.langchain4j.model.output.TokenUsage usage) {
        if (usage == null) {
            return TokenUsage.empty();
        }
        int prompt = usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
        int completion = usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
        int total = usage.totalTokenCount() == null ? prompt + completion : usage.totalTokenCount();
        return new TokenUsage(prompt, completion, total);
    }

    static String finishReason(FinishReason reason) {
        return reason == null ? "" : reason.name().toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link LangChain4jChatClient}.
    public static final class Builder {
        private ModelFactory modelFactory;
        private final Map<String, ChatModel> chatModels = new HashMap<>();
        private final Map<String, StreamingChatModel> streamingModels = new HashMap<>();
        private final Map<String, ModelPricing> pricing = new HashMap<>();

        private Builder() {}

        /// Creates models for names that are not registered explicitly.
        public Builder modelFactory(ModelFactory modelFactory) {
            this.modelFactory = modelFactory;
            return this;
        }

        public Builder chatModel(String name, ChatModel model) {
            Objects.requireNonNull(name, "name must not be null");
            chatModels.put(name, Objects.requireNonNull(model, "model must not be null"));
            return this;
        }

        public Builder streamingModel(String name, StreamingChatModel model) {
            Objects.requireNonNull(name, "name must not be null");
            streamingModels.put(name, Objects.requireNonNull(model, "model must not be null"));
            return this;
        }

        public Builder pricing(String name, ModelPricing modelPricing) {
            Objects.requireNonNull(name, "name must not be null");
            pricing.put(name, Objects.requireNonNull(modelPricing, "modelPricing must not be null"));
            return this;
        }

        /// @return the client, never null
        /// @throws IllegalStateException if neither a factory nor any model is configured
        public LangChain4jChatClient build() {
            if (modelFactory == null && chatModels.isEmpty() && streamingModels.isEmpty()) {
                throw new IllegalStateException("A model factory or at least one model is required");
            }
            return new LangChain4jChatClient(this);
        }
    }
}
