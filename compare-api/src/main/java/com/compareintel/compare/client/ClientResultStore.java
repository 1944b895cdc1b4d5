package com.compareintel.compare.client;

import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ModelResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Visibility state for the result cards of the latest comparison.
 * <p>
 * Closing a card only hides it; the received results are never modified. The closed keys are always a subset of
 * the installed result keys and are dropped whenever a new comparison starts.
 */
public class ClientResultStore {

    private Map<String, ModelResult> fullResultSet = Map.of();
    private final Set<String> closedKeys = new LinkedHashSet<>();

    /**
     * Called when the user submits a new comparison, before its response arrives.
     */
    public synchronized void beginComparison() {
        closedKeys.clear();
        fullResultSet = Map.of();
    }

    public synchronized void install(ComparisonResponse response) {
        closedKeys.clear();
        if (response == null || response.results() == null) {
            fullResultSet = Map.of();
            return;
        }
        fullResultSet = Collections.unmodifiableMap(new LinkedHashMap<>(response.results()));
    }

    /**
     * @return {@code true} if the card was visible and is now hidden
     */
    public synchronized boolean closeResultCard(String modelId) {
        if (modelId == null || !fullResultSet.containsKey(modelId)) {
            return false;
        }
        return closedKeys.add(modelId);
    }

    public synchronized void showAllResults() {
        closedKeys.clear();
    }

    public synchronized Map<String, ModelResult> visibleResults() {
        Map<String, ModelResult> visible = new LinkedHashMap<>();
        fullResultSet.forEach((modelId, result) -> {
            if (!closedKeys.contains(modelId)) {
                visible.put(modelId, result);
            }
        });
        return Collections.unmodifiableMap(visible);
    }

    public synchronized int hiddenCount() {
        return closedKeys.size();
    }

    public synchronized Map<String, ModelResult> fullResultSet() {
        return fullResultSet;
    }

    public synchronized Set<String> closedKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(closedKeys));
    }
}
