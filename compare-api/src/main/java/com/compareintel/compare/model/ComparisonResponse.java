package com.compareintel.compare.model;

import java.util.Map;

public record ComparisonResponse(
        Map<String, ModelResult> results,
        ComparisonMetadata metadata
) {
}
