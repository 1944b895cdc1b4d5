package com.compareintel.compare.service.stats;

import com.compareintel.compare.model.ComparisonMetadata;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ErrorKind;
import com.compareintel.compare.model.ModelResult;
import com.compareintel.compare.model.ModelStats;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ModelStatsTrackerTest {

    private final ModelStatsTracker tracker = new ModelStatsTracker();

    @Test
    void accumulatesPerModelCountsAcrossComparisons() {
        OffsetDateTime first = OffsetDateTime.of(2026, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);
        OffsetDateTime second = first.plusMinutes(5);
        OffsetDateTime third = second.plusMinutes(5);

        tracker.record(response(first, ModelResult.succeeded("alpha", "x", 10), ModelResult.failed("beta", ErrorKind.TIMEOUT, "Timeout (2s)", 2000)));
        tracker.record(response(second, ModelResult.succeeded("alpha", "y", 10), ModelResult.succeeded("beta", "z", 10)));
        tracker.record(response(third, ModelResult.failed("alpha", ErrorKind.SERVER_ERROR, "Provider server error", 10)));

        Map<String, ModelStats> snapshot = tracker.snapshot();

        assertThat(snapshot.keySet()).containsExactly("alpha", "beta");
        ModelStats alpha = snapshot.get("alpha");
        assertThat(alpha.successCount()).isEqualTo(2);
        assertThat(alpha.failureCount()).isEqualTo(1);
        assertThat(alpha.totalAttempts()).isEqualTo(3);
        assertThat(alpha.successRate()).isEqualTo(66.7);
        assertThat(alpha.lastSuccess()).isEqualTo(second);
        assertThat(alpha.lastError()).isEqualTo(third);

        ModelStats beta = snapshot.get("beta");
        assertThat(beta.successRate()).isEqualTo(50.0);
        assertThat(beta.lastError()).isEqualTo(first);
    }

    @Test
    void snapshotIsEmptyBeforeAnyComparison() {
        assertThat(tracker.snapshot()).isEmpty();
    }

    private ComparisonResponse response(OffsetDateTime timestamp, ModelResult... results) {
        Map<String, ModelResult> byId = new LinkedHashMap<>();
        int succeeded = 0;
        for (ModelResult result : results) {
            byId.put(result.modelId(), result);
            if (result.status().succeeded()) {
                succeeded++;
            }
        }
        return new ComparisonResponse(byId, new ComparisonMetadata(results.length, succeeded, results.length - succeeded, 10, 100, timestamp));
    }
}
