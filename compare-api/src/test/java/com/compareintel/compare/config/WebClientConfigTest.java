package com.compareintel.compare.config;

import com.compareintel.compare.service.provider.ProviderType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientConfigTest {

    private final WebClientConfig config = new WebClientConfig();
    private final ComparisonProperties properties = new ComparisonProperties(9, 9, 15000, 20, null, Map.of(
            ProviderType.OPENAI, new ProviderSettings("https://gateway.internal", "sk-openai", Duration.ofSeconds(5), null, null),
            ProviderType.ANTHROPIC, new ProviderSettings(null, "sk-ant", null, null, null),
            ProviderType.GEMINI, new ProviderSettings(null, "", null, null, null)
    ), List.of());

    @Test
    void openAiClientSendsBearerTokenToConfiguredBaseUrl() {
        ClientRequest request = capture(config.openAiWebClient(properties), "/v1/chat/completions");

        assertThat(request.url().toString()).isEqualTo("https://gateway.internal/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-openai");
    }

    @Test
    void anthropicClientSendsApiKeyAndVersionToDefaultEndpoint() {
        ClientRequest request = capture(config.anthropicWebClient(properties), "/v1/messages");

        assertThat(request.url().getHost()).isEqualTo("api.anthropic.com");
        assertThat(request.headers().getFirst("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.headers().getFirst("anthropic-version")).isEqualTo("2023-06-01");
    }

    @Test
    void geminiClientWithoutKeyCarriesNoCredentials() {
        ClientRequest request = capture(config.geminiWebClient(properties), "/v1beta/models");

        assertThat(request.url().getHost()).isEqualTo("generativelanguage.googleapis.com");
        assertThat(request.headers().containsKey("x-goog-api-key")).isFalse();
    }

    private ClientRequest capture(WebClient client, String path) {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        client.mutate()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build());
                })
                .build()
                .post()
                .uri(path)
                .retrieve()
                .toBodilessEntity()
                .block();
        return captured.get();
    }
}
