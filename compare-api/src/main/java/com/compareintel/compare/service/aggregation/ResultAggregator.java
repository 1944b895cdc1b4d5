package com.compareintel.compare.service.aggregation;

import com.compareintel.compare.model.ComparisonMetadata;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ModelResult;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Component
public class ResultAggregator {

    public ResultCollector open(List<String> modelIds) {
        return new ResultCollector(modelIds);
    }

    /**
     * Builds the response once every requested model has a terminal result.
     *
     * @throws AggregationException when a requested model has no result
     */
    public ComparisonResponse aggregate(ResultCollector collector, int inputLength, long processingTimeMs) {
        Map<String, ModelResult> results = collector.complete();
        int succeeded = (int) results.values().stream()
                .filter(result -> result.status().succeeded())
                .count();
        ComparisonMetadata metadata = new ComparisonMetadata(
                results.size(),
                succeeded,
                results.size() - succeeded,
                inputLength,
                processingTimeMs,
                OffsetDateTime.now()
        );
        return new ComparisonResponse(results, metadata);
    }
}
