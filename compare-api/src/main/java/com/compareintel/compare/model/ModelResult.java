package com.compareintel.compare.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelResult(
        String modelId,
        ResultStatus status,
        String content,
        ErrorKind errorKind,
        String errorMessage,
        long latencyMs
) {

    public ModelResult {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(status, "status");
        if (status.succeeded()) {
            if (content == null || errorKind != null || errorMessage != null) {
                throw new IllegalArgumentException("Succeeded result for " + modelId + " must carry content and no error");
            }
        } else if (content != null || errorKind == null || errorMessage == null) {
            throw new IllegalArgumentException("Failed result for " + modelId + " must carry an error and no content");
        }
        latencyMs = Math.max(0, latencyMs);
    }

    public static ModelResult succeeded(String modelId, String content, long latencyMs) {
        return new ModelResult(modelId, ResultStatus.SUCCEEDED, content, null, null, latencyMs);
    }

    public static ModelResult failed(String modelId, ErrorKind errorKind, String errorMessage, long latencyMs) {
        return new ModelResult(modelId, errorKind.status(), null, errorKind, errorMessage, latencyMs);
    }
}
