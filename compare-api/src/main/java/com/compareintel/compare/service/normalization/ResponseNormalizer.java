package com.compareintel.compare.service.normalization;

import com.compareintel.compare.model.ErrorKind;
import com.compareintel.compare.model.ModelResult;
import com.compareintel.compare.service.provider.EnvelopeFormat;
import com.compareintel.compare.service.provider.FailureClass;
import com.compareintel.compare.service.provider.RawOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a provider's raw outcome into a {@link ModelResult}.
 * <p>
 * Generated text is copied out of the provider envelope exactly as received. Stateless.
 */
@Component
public class ResponseNormalizer {

    public ModelResult normalize(String modelId, RawOutcome outcome, long latencyMs) {
        if (outcome.successful()) {
            return extractText(outcome.format(), outcome.payload())
                    .map(content -> ModelResult.succeeded(modelId, content, latencyMs))
                    .orElseGet(() -> ModelResult.failed(modelId, ErrorKind.MALFORMED_RESPONSE,
                            "Malformed response: no text in " + outcome.format() + " payload", latencyMs));
        }
        return ModelResult.failed(modelId, errorKind(outcome.failure()), errorMessage(outcome), latencyMs);
    }

    ErrorKind errorKind(FailureClass failure) {
        return switch (failure) {
            case AUTH -> ErrorKind.AUTH_ERROR;
            case RATE_LIMITED -> ErrorKind.RATE_LIMITED;
            case SERVER -> ErrorKind.SERVER_ERROR;
            case NOT_FOUND -> ErrorKind.MODEL_UNAVAILABLE;
            case REJECTED -> ErrorKind.REQUEST_REJECTED;
            case MALFORMED -> ErrorKind.MALFORMED_RESPONSE;
            case NETWORK -> ErrorKind.NETWORK_ERROR;
            case DEADLINE_EXCEEDED -> ErrorKind.TIMEOUT;
            case UNEXPECTED -> ErrorKind.UNKNOWN;
        };
    }

    private String errorMessage(RawOutcome outcome) {
        if (outcome.failure() == FailureClass.DEADLINE_EXCEEDED) {
            return "Timeout (" + (outcome.detail() == null ? "deadline exceeded" : outcome.detail()) + ")";
        }
        StringBuilder message = new StringBuilder(switch (outcome.failure()) {
            case AUTH -> "Authentication failed";
            case RATE_LIMITED -> "Rate limited";
            case SERVER -> "Provider server error";
            case NOT_FOUND -> "Model not available";
            case REJECTED -> "Request rejected by provider";
            case MALFORMED -> "Malformed response";
            case NETWORK -> "Network error";
            default -> "Unexpected provider failure";
        });
        if (outcome.httpStatus() != null) {
            message.append(" (HTTP ").append(outcome.httpStatus()).append(')');
        }
        if (outcome.detail() != null && !outcome.detail().isBlank()) {
            message.append(": ").append(outcome.detail());
        }
        return message.toString();
    }

    private Optional<String> extractText(EnvelopeFormat format, JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Optional.empty();
        }
        return switch (format) {
            case OPENAI_CHAT -> textOf(payload.path("choices").path(0).path("message").path("content"));
            case ANTHROPIC_MESSAGES -> joinTextBlocks(payload.path("content"), true);
            case GEMINI_GENERATE -> joinTextBlocks(payload.path("candidates").path(0).path("content").path("parts"), false);
            case PLAIN_TEXT -> textOf(payload);
        };
    }

    private Optional<String> joinTextBlocks(JsonNode blocks, boolean typed) {
        if (!blocks.isArray()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        boolean found = false;
        for (JsonNode block : blocks) {
            if (typed && !"text".equals(block.path("type").asText())) {
                continue;
            }
            JsonNode value = block.path("text");
            if (value.isTextual()) {
                text.append(value.asText());
                found = true;
            }
        }
        return found ? Optional.of(text.toString()) : Optional.empty();
    }

    private Optional<String> textOf(JsonNode node) {
        return node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }
}
