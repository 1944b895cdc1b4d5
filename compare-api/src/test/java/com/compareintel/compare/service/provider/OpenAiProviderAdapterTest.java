package com.compareintel.compare.service.provider;

import com.compareintel.compare.config.ComparisonProperties;
import com.compareintel.compare.config.ProviderSettings;
import com.compareintel.compare.model.ConversationMessage;
import com.compareintel.compare.model.ModelDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiProviderAdapterTest {

    private static final String COMPLETION = """
            {"id":"chatcmpl-1","choices":[{"index":0,"message":{"role":"assistant","content":"Hi there"},"finish_reason":"stop"}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ModelDescriptor model = new ModelDescriptor("openai/gpt-4o", "GPT-4o", ProviderType.OPENAI, "gpt-4o", null, 512);
    private final ProviderExchangeStub exchange = new ProviderExchangeStub();

    @Test
    void postsChatCompletionAndReturnsEnvelope() throws Exception {
        exchange.reply(HttpStatus.OK, COMPLETION);

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.successful()).isTrue();
        assertThat(outcome.format()).isEqualTo(EnvelopeFormat.OPENAI_CHAT);
        assertThat(outcome.payload().path("choices").path(0).path("message").path("content").asText()).isEqualTo("Hi there");

        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.requests().get(0).url().getPath()).isEqualTo("/v1/chat/completions");
        JsonNode body = objectMapper.readTree(ProviderExchangeStub.bodyOf(exchange.requests().get(0)));
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.path("stream").asBoolean()).isFalse();
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("Be brief.");
        assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("Say hi");
    }

    @Test
    void historyIsSentBetweenSystemAndNewPrompt() throws Exception {
        exchange.reply(HttpStatus.OK, COMPLETION);
        ProviderPrompt prompt = new ProviderPrompt("And in French?",
                List.of(ConversationMessage.user("Say hi"), ConversationMessage.assistant("Hi there")), 3);

        adapter("sk-test").submit(model, prompt, Duration.ofSeconds(2));

        JsonNode messages = objectMapper.readTree(ProviderExchangeStub.bodyOf(exchange.requests().get(0))).path("messages");
        assertThat(messages).hasSize(4);
        assertThat(messages.path(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.path(0).path("content").asText())
                .startsWith("Be brief.")
                .contains("Earlier conversation context (3 messages) has been omitted");
        assertThat(messages.path(1).path("role").asText()).isEqualTo("user");
        assertThat(messages.path(1).path("content").asText()).isEqualTo("Say hi");
        assertThat(messages.path(2).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.path(2).path("content").asText()).isEqualTo("Hi there");
        assertThat(messages.path(3).path("role").asText()).isEqualTo("user");
        assertThat(messages.path(3).path("content").asText()).isEqualTo("And in French?");
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        exchange.reply(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{\"message\":\"overloaded\"}}")
                .reply(HttpStatus.BAD_GATEWAY, "")
                .reply(HttpStatus.OK, COMPLETION);

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.successful()).isTrue();
        assertThat(exchange.requests()).hasSize(3);
    }

    @Test
    void rateLimitIsReportedOnceAttemptsAreExhausted() {
        exchange.reply(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"message\":\"Rate limit reached for gpt-4o\"}}");

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.failure()).isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(outcome.httpStatus()).isEqualTo(429);
        assertThat(outcome.detail()).isEqualTo("Rate limit reached for gpt-4o");
        assertThat(exchange.requests()).hasSize(3);
    }

    @Test
    void authFailureIsNotRetried() {
        exchange.reply(HttpStatus.UNAUTHORIZED, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.failure()).isEqualTo(FailureClass.AUTH);
        assertThat(outcome.httpStatus()).isEqualTo(401);
        assertThat(outcome.detail()).isEqualTo("Incorrect API key provided");
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void badRequestIsRejectedWithRawBodyAsDetail() {
        exchange.reply(HttpStatus.BAD_REQUEST, "context length exceeded");

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.failure()).isEqualTo(FailureClass.REJECTED);
        assertThat(outcome.detail()).isEqualTo("context length exceeded");
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void silentProviderHitsTheDeadline() {
        exchange.never();

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofMillis(200));

        assertThat(outcome.failure()).isEqualTo(FailureClass.DEADLINE_EXCEEDED);
        assertThat(outcome.detail()).isEqualTo("200ms");
    }

    @Test
    void unreadableBodyIsMalformed() {
        exchange.reply(HttpStatus.OK, "<html>gateway</html>");

        RawOutcome outcome = adapter("sk-test").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.failure()).isEqualTo(FailureClass.MALFORMED);
    }

    @Test
    void missingApiKeyFailsWithoutCallingTheProvider() {
        exchange.reply(HttpStatus.OK, COMPLETION);

        RawOutcome outcome = adapter("").submit(model, ProviderPrompt.of("Say hi"), Duration.ofSeconds(2));

        assertThat(outcome.failure()).isEqualTo(FailureClass.AUTH);
        assertThat(outcome.detail()).isEqualTo("No API key configured for provider openai");
        assertThat(exchange.requests()).isEmpty();
    }

    private OpenAiProviderAdapter adapter(String apiKey) {
        ComparisonProperties properties = new ComparisonProperties(9, 9, 15000, 20, "Be brief.",
                Map.of(ProviderType.OPENAI, new ProviderSettings(null, apiKey, Duration.ofSeconds(2), 3, Duration.ofMillis(5))),
                List.of(model));
        return new OpenAiProviderAdapter(exchange.webClient(), properties, objectMapper);
    }
}
