package com.compareintel.compare.service.provider;

import com.compareintel.compare.config.ProviderSettings;
import com.compareintel.compare.model.ModelDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Base for adapters that talk JSON over HTTP through a pre-authenticated {@link WebClient}.
 * Subclasses only describe the endpoint, the request body and the success envelope.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);
    private static final int MAX_DETAIL_LENGTH = 200;

    protected final WebClient webClient;
    protected final ProviderSettings settings;
    protected final String systemPrompt;

    private final ProviderType type;
    private final ObjectMapper objectMapper;

    protected HttpProviderAdapter(ProviderType type,
                                  WebClient webClient,
                                  ProviderSettings settings,
                                  String systemPrompt,
                                  ObjectMapper objectMapper) {
        this.type = type;
        this.webClient = webClient;
        this.settings = settings;
        this.systemPrompt = systemPrompt;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderType type() {
        return type;
    }

    @Override
    public RawOutcome submit(ModelDescriptor model, ProviderPrompt prompt, Duration timeout) {
        if (!settings.hasApiKey()) {
            log.warn("No API key configured for provider {}, model {} not called", type, model.id());
            return RawOutcome.failure(FailureClass.AUTH, null,
                    "No API key configured for provider " + type.name().toLowerCase(Locale.ROOT));
        }
        try {
            RawOutcome outcome = webClient.post()
                    .uri(path(model))
                    .bodyValue(requestBody(model, prompt))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(retrySpec(model))
                    .timeout(timeout)
                    .map(body -> RawOutcome.success(envelope(), body))
                    .onErrorResume(ex -> Mono.just(classify(model, ex, timeout)))
                    .block();
            return outcome == null
                    ? RawOutcome.failure(FailureClass.MALFORMED, null, "Provider returned an empty body")
                    : outcome;
        } catch (RuntimeException ex) {
            if (Thread.currentThread().isInterrupted() || Exceptions.unwrap(ex) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                log.debug("Call to {} for model {} was cancelled", type, model.id());
                return RawOutcome.failure(FailureClass.NETWORK, null, "Call cancelled");
            }
            throw ex;
        }
    }

    protected abstract String path(ModelDescriptor model);

    protected abstract Map<String, Object> requestBody(ModelDescriptor model, ProviderPrompt prompt);

    protected abstract EnvelopeFormat envelope();

    private Retry retrySpec(ModelDescriptor model) {
        return Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
                .filter(this::isTransient)
                .doBeforeRetry(signal -> log.info("Retrying {} for model {} after {} (attempt {}/{})",
                        type, model.id(), describe(signal.failure()), signal.totalRetries() + 2, settings.maxAttempts()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isTransient(Throwable throwable) {
        return throwable instanceof WebClientResponseException response
                && FailureClass.fromHttpStatus(response.getStatusCode().value()).transientFailure();
    }

    private RawOutcome classify(ModelDescriptor model, Throwable throwable, Duration timeout) {
        if (throwable instanceof TimeoutException) {
            log.warn("Provider {} did not answer for model {} within {}", type, model.id(), timeout);
            return RawOutcome.deadlineExceeded(timeout);
        }
        if (throwable instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            log.warn("Provider {} returned {} for model {}: {}", type, status, model.id(), response.getResponseBodyAsString());
            return RawOutcome.failure(FailureClass.fromHttpStatus(status), status, errorDetail(response));
        }
        if (throwable instanceof WebClientRequestException) {
            log.warn("Provider {} unreachable for model {}: {}", type, model.id(), throwable.getMessage());
            return RawOutcome.failure(FailureClass.NETWORK, null, truncate(throwable.getMessage()));
        }
        if (throwable instanceof DecodingException || throwable instanceof JsonProcessingException) {
            log.warn("Provider {} sent an unreadable body for model {}: {}", type, model.id(), throwable.getMessage());
            return RawOutcome.failure(FailureClass.MALFORMED, null, "Response body is not valid JSON");
        }
        log.error("Unexpected failure calling provider {} for model {}", type, model.id(), throwable);
        return RawOutcome.failure(FailureClass.UNEXPECTED, null, truncate(throwable.getMessage()));
    }

    private String errorDetail(WebClientResponseException response) {
        String body = response.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return truncate(message.asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body from {} is not JSON", type);
        }
        return truncate(body);
    }

    private String describe(Throwable failure) {
        return failure instanceof WebClientResponseException response
                ? "HTTP " + response.getStatusCode().value()
                : failure.getClass().getSimpleName();
    }

    private String truncate(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.length() <= MAX_DETAIL_LENGTH ? trimmed : trimmed.substring(0, MAX_DETAIL_LENGTH - 3) + "...";
    }
}
