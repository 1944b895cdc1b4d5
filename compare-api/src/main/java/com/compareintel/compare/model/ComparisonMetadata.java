package com.compareintel.compare.model;

import java.time.OffsetDateTime;

public record ComparisonMetadata(
        int requested,
        int succeeded,
        int failed,
        int inputLength,
        long processingTimeMs,
        OffsetDateTime timestamp
) {
}
