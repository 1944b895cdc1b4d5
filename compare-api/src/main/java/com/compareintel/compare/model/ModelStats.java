package com.compareintel.compare.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelStats(
        long successCount,
        long failureCount,
        long totalAttempts,
        double successRate,
        OffsetDateTime lastSuccess,
        OffsetDateTime lastError
) {
}
