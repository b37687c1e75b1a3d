package io.tasktree.core.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// {@link ChatClient} returning canned responses, for tests and offline runs.
///
/// Responses are registered per model; unregistered models get the default
/// response. Streaming splits the text into chunks of `chunkSize` characters.
/// Every request is recorded.
public class StubChatClient implements ChatClient {

    private static final Logger logger = Logger.getLogger(StubChatClient.class.getName());

    private final Map<String, ChatCompletion> responses = new ConcurrentHashMap<>();
    private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
    private volatile ChatCompletion defaultResponse;
    private volatile int chunkSize = 8;

    public StubChatClient() {
        this("stub response");
    }

    public StubChatClient(String defaultText) {
        this.defaultResponse = new ChatCompletion(defaultText, "stop", TokenUsage.empty(), 0);
    }

    public StubChatClient respond(String model, ChatCompletion completion) {
        responses.put(
                Objects.requireNonNull(model, "model must not be null"),
                Objects.requireNonNull(completion, "completion must not be null"));
        return this;
    }

    public StubChatClient respond(String model, String text) {
        return respond(model, new ChatCompletion(text, "stop", TokenUsage.empty(), 0));
    }

    public StubChatClient defaultResponse(ChatCompletion completion) {
        this.defaultResponse = Objects.requireNonNull(completion, "completion must not be null");
        return this;
    }

    public StubChatClient chunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
        return this;
    }

    /// @return the recorded requests in call order, never null
    public List<ChatRequest> getRequests() {
        return List.copyOf(requests);
    }

    @Override
    public ChatCompletion complete(ChatRequest request) {
        requests.add(request);
        ChatCompletion completion = responses.getOrDefault(request.model(), defaultResponse);
        logger.fine("Stub response for model " + request.model());
        return completion;
    }

    @Override
    public ChatCompletion stream(ChatRequest request, Consumer<ChatChunk> onChunk) {
        ChatCompletion completion = complete(request);
        String text = completion.text();
        List<String> pieces = new ArrayList<>();
        for (int i = 0; i < text.length(); i += chunkSize) {
            pieces.add(text.substring(i, Math.min(text.length(), i + chunkSize)));
        }
        for (int i = 0; i < pieces.size(); i++) {
            boolean last = i == pieces.size() - 1;
            onChunk.accept(new ChatChunk(pieces.get(i), last ? completion.finishReason() : ""));
        }
        return completion;
    }
}
