package com.compareintel.compare.service.aggregation;

import com.compareintel.compare.model.ModelResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fan-in target for one comparison. Tasks record concurrently, each key exactly once.
 */
public final class ResultCollector {

    private final Set<String> requested;
    private final ConcurrentMap<String, ModelResult> results = new ConcurrentHashMap<>();

    ResultCollector(List<String> modelIds) {
        this.requested = Collections.unmodifiableSet(new LinkedHashSet<>(modelIds));
        if (requested.size() != modelIds.size()) {
            throw new AggregationException("Requested model ids contain duplicates: " + modelIds);
        }
    }

    public void record(ModelResult result) {
        String modelId = result.modelId();
        if (!requested.contains(modelId)) {
            throw new AggregationException("Result recorded for model " + modelId + " which was not requested");
        }
        ModelResult previous = results.putIfAbsent(modelId, result);
        if (previous != null) {
            throw new AggregationException("Result for model " + modelId + " was recorded twice");
        }
    }

    public int recordedCount() {
        return results.size();
    }

    public Set<String> requested() {
        return requested;
    }

    Map<String, ModelResult> complete() {
        List<String> missing = requested.stream()
                .filter(modelId -> !results.containsKey(modelId))
                .toList();
        if (!missing.isEmpty()) {
            throw new AggregationException("No result recorded for models " + missing);
        }
        Map<String, ModelResult> ordered = new LinkedHashMap<>();
        requested.forEach(modelId -> ordered.put(modelId, results.get(modelId)));
        return Collections.unmodifiableMap(ordered);
    }
}
