package io.tasktree.core.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.tasktree.core.GlobalDefaults;
import io.tasktree.core.exception.TreeProgrammingException;
import io.tasktree.core.execution.ExecutionContext;
import io.tasktree.core.result.Result;
import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.trace.Traces;
import io.tasktree.core.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class LlmNodeTest {

    static class Chat {
        final String question;
        final List<String> partials = new ArrayList<>();
        String finalText;
        String finalReason;

        Chat(String question) {
            this.question = question;
        }
    }

    @AfterEach
    void resetDefaults() {
        GlobalDefaults.reset();
    }

    @Nested
    @DisplayName("completion")
    class Completion {

        @Test
        void shouldReturnTextAndRecordUsage() {
            // Given
            StubChatClient client =
                    new StubChatClient()
                            .respond(
                                    "small",
                                    new ChatCompletion("42", "stop", new TokenUsage(10, 2, 12), 0.003));
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm(
                                    LlmSettings.<Chat>builder()
                                            .model("small")
                                            .messages(c -> List.of(ChatMessage.user(c.question)))
                                            .client(client)
                                            .apiKey("sk-secret")
                                            .option("temperature", 0.2)
                                            .build())
                            .build();
            ExecutionContext context = ExecutionContext.create();

            // When
            Result result = tree.run(new Chat("answer?"), context);

            // Then
            assertThat(result).isEqualTo(Result.ok("42"));
            TraceNode span = Traces.find(context.getTraceRoot(), "T/LLM");
            assertThat(span.getAttribute("model")).isEqualTo("small");
            assertThat(span.getAttribute("api_key")).isEqualTo("***");
            assertThat(span.getAttribute("tokens"))
                    .isEqualTo(Map.of("prompt", 10, "completion", 2, "total", 12));
            assertThat(span.getAttribute("finish_reason")).isEqualTo("stop");
            assertThat(span.getCost()).isEqualTo(0.003);
            assertThat(context.getTraceRoot().getTotalCost()).isEqualTo(0.003);

            ChatRequest request = client.getRequests().get(0);
            assertThat(request.messages()).containsExactly(ChatMessage.user("answer?"));
            assertThat(request.apiKey()).isEqualTo("sk-secret");
            assertThat(request.options()).containsEntry("temperature", 0.2);
        }

        @Test
        void shouldUseContextClientAndGlobalApiKeyFactory() {
            // Given
            StubChatClient client = new StubChatClient("from context");
            GlobalDefaults.setApiKeyFactory(board -> "key-for-" + ((Chat) board).question);
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm("any", c -> List.of(ChatMessage.user(c.question)))
                            .build();

            // When
            Result result =
                    tree.run(new Chat("q"), ExecutionContext.builder().chatClient(client).build());

            // Then
            assertThat(result).isEqualTo(Result.ok("from context"));
            assertThat(client.getRequests().get(0).apiKey()).isEqualTo("key-for-q");
        }

        @Test
        void shouldRaiseWithoutClient() {
            // Given
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm("any", c -> List.of(ChatMessage.user(c.question)))
                            .build();

            // When/Then
            assertThatThrownBy(() -> tree.run(new Chat("q")))
                    .isInstanceOf(TreeProgrammingException.class)
                    .hasMessageContaining("no chat client");
        }

        @Test
        void shouldRequireModelAndMessages() {
            assertThatThrownBy(() -> LlmSettings.<Chat>builder().model("m").build())
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(
                            () ->
                                    LlmSettings.<Chat>builder()
                                            .messages(c -> List.of())
                                            .build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("streaming")
    class Streaming {

        @Test
        void shouldReportDeltasThenFinalCall() {
            // Given
            StubChatClient client = new StubChatClient().respond("m", "abcdefgh").chunkSize(3);
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm(
                                    LlmSettings.<Chat>builder()
                                            .model("m")
                                            .messages(c -> List.of(ChatMessage.user(c.question)))
                                            .client(client)
                                            .onDelta(
                                                    (c, full, delta, finished, reason) -> {
                                                        if (finished) {
                                                            c.finalText = full;
                                                            c.finalReason = reason;
                                                        } else {
                                                            c.partials.add(full + "|" + delta + "|" + reason);
                                                        }
                                                    })
                                            .build())
                            .build();
            Chat chat = new Chat("q");

            // When
            Result result = tree.run(chat);

            // Then
            assertThat(result).isEqualTo(Result.ok("abcdefgh"));
            assertThat(chat.partials).containsExactly("abc|abc|", "abcdef|def|", "abcdefgh|gh|stop");
            assertThat(chat.finalText).isEqualTo("abcdefgh");
            assertThat(chat.finalReason).isEqualTo("stop");
        }

        @Test
        void shouldFailWhenDeltaCallbackRaises() {
            // Given
            StubChatClient client = new StubChatClient().respond("m", "text");
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm(
                                    LlmSettings.<Chat>builder()
                                            .model("m")
                                            .messages(c -> List.of())
                                            .client(client)
                                            .onDelta(
                                                    (c, full, delta, finished, reason) -> {
                                                        throw new IllegalStateException("ui gone");
                                                    })
                                            .build())
                            .build();

            // When/Then
            assertThat(tree.run(new Chat("q"))).isEqualTo(Result.fail());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("client errors")
    class ClientErrors {

        @Mock private ChatClient client;

        @Test
        void shouldFailWhenClientRaises() throws Exception {
            // Given
            when(client.complete(any())).thenThrow(new IllegalStateException("rate limited"));
            Tree<Chat> tree =
                    Tree.<Chat>builder("T")
                            .llm(
                                    LlmSettings.<Chat>builder()
                                            .model("m")
                                            .messages(c -> List.of(ChatMessage.user(c.question)))
                                            .client(client)
                                            .build())
                            .build();
            ExecutionContext context = ExecutionContext.create();

            // When
            Result result = tree.run(new Chat("q"), context);

            // Then
            assertThat(result).isEqualTo(Result.fail());
            assertThat(Traces.find(context.getTraceRoot(), "T/LLM").getAttribute("error"))
                    .isEqualTo("IllegalStateException: rate limited");
        }
    }
}
