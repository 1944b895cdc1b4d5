package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.model.ComparisonRequest;
import com.compareintel.compare.model.ComparisonResponse;
import reactor.core.publisher.Mono;

public interface RequestDispatcher {

    /**
     * Runs the prompt against every requested model and completes once all of them reached a terminal state.
     * Fails with {@link ComparisonValidationException} before any provider is called when the request is invalid.
     */
    Mono<ComparisonResponse> dispatch(ComparisonRequest request);
}
