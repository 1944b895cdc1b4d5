package com.compareintel.compare.service.stats;

import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ModelResult;
import com.compareintel.compare.model.ModelStats;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory success/failure bookkeeping per model since process start.
 */
@Component
public class ModelStatsTracker {

    private final ConcurrentMap<String, Counters> counters = new ConcurrentHashMap<>();

    public void record(ComparisonResponse response) {
        OffsetDateTime timestamp = response.metadata().timestamp();
        for (ModelResult result : response.results().values()) {
            counters.computeIfAbsent(result.modelId(), modelId -> new Counters())
                    .record(result.status().succeeded(), timestamp);
        }
    }

    public Map<String, ModelStats> snapshot() {
        Map<String, ModelStats> stats = new TreeMap<>();
        counters.forEach((modelId, modelCounters) -> stats.put(modelId, modelCounters.toStats()));
        return Collections.unmodifiableMap(stats);
    }

    private static final class Counters {

        private long success;
        private long failure;
        private OffsetDateTime lastSuccess;
        private OffsetDateTime lastError;

        synchronized void record(boolean succeeded, OffsetDateTime timestamp) {
            if (succeeded) {
                success++;
                lastSuccess = timestamp;
            } else {
                failure++;
                lastError = timestamp;
            }
        }

        synchronized ModelStats toStats() {
            long total = success + failure;
            double rate = total == 0 ? 0.0 : Math.round(success * 1000.0 / total) / 10.0;
            return new ModelStats(success, failure, total, rate, lastSuccess, lastError);
        }
    }
}
