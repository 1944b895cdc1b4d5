package com.compareintel.compare.client;

import com.compareintel.compare.model.ComparisonMetadata;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ErrorKind;
import com.compareintel.compare.model.ModelResult;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClientResultStoreTest {

    private final ClientResultStore store = new ClientResultStore();

    @Test
    void closingHidesOnlyTheChosenCard() {
        ComparisonResponse response = response("a", "b", "c");
        store.install(response);

        assertThat(store.closeResultCard("b")).isTrue();

        assertThat(store.visibleResults().keySet()).containsExactly("a", "c");
        assertThat(store.hiddenCount()).isEqualTo(1);
        assertThat(store.fullResultSet()).isEqualTo(response.results());
    }

    @Test
    void closingUnknownOrAlreadyClosedCardIsANoOp() {
        store.install(response("a", "b"));
        store.closeResultCard("a");

        assertThat(store.closeResultCard("a")).isFalse();
        assertThat(store.closeResultCard("zzz")).isFalse();
        assertThat(store.closeResultCard(null)).isFalse();
        assertThat(store.closedKeys()).containsExactly("a");
    }

    @Test
    void closingEveryCardLeavesNothingVisible() {
        store.install(response("a", "b"));
        store.closeResultCard("a");
        store.closeResultCard("b");

        assertThat(store.visibleResults()).isEmpty();
        assertThat(store.hiddenCount()).isEqualTo(2);
        assertThat(store.fullResultSet()).hasSize(2);
    }

    @Test
    void showAllRestoresTheFullSetInOriginalOrder() {
        ComparisonResponse response = response("a", "b", "c");
        store.install(response);
        store.closeResultCard("c");
        store.closeResultCard("a");

        store.showAllResults();

        assertThat(store.visibleResults()).isEqualTo(response.results());
        assertThat(store.visibleResults().keySet()).containsExactly("a", "b", "c");
        assertThat(store.hiddenCount()).isZero();
    }

    @Test
    void newComparisonClearsClosedCards() {
        store.install(response("a", "b"));
        store.closeResultCard("a");

        store.beginComparison();
        assertThat(store.closedKeys()).isEmpty();
        assertThat(store.visibleResults()).isEmpty();

        store.install(response("a", "b"));
        assertThat(store.visibleResults().keySet()).containsExactly("a", "b");
    }

    @Test
    void closedKeysStayWithinTheInstalledResults() {
        store.install(response("a", "b"));
        store.closeResultCard("a");
        store.install(response("x"));

        assertThat(store.fullResultSet().keySet()).containsAll(store.closedKeys());
        assertThat(store.closedKeys()).isEmpty();
    }

    private ComparisonResponse response(String... modelIds) {
        Map<String, ModelResult> results = new LinkedHashMap<>();
        int succeeded = 0;
        for (int i = 0; i < modelIds.length; i++) {
            String modelId = modelIds[i];
            if (i % 2 == 0) {
                results.put(modelId, ModelResult.succeeded(modelId, "answer from " + modelId, 100));
                succeeded++;
            } else {
                results.put(modelId, ModelResult.failed(modelId, ErrorKind.RATE_LIMITED, "Rate limited", 30));
            }
        }
        return new ComparisonResponse(results, new ComparisonMetadata(
                modelIds.length, succeeded, modelIds.length - succeeded, 12, 150, OffsetDateTime.now()));
    }
}
