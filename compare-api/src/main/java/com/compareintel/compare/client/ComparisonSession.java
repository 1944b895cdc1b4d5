package com.compareintel.compare.client;

import com.compareintel.compare.model.ComparisonRequest;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ConversationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;

/**
 * One UI session: submits comparisons and keeps the result store in step with them.
 * <p>
 * Only the latest submission may install results. Starting a new comparison or calling {@link #cancel()} aborts the
 * one in flight; an aborted submission completes empty and leaves the store untouched.
 */
public class ComparisonSession {

    private static final Logger log = LoggerFactory.getLogger(ComparisonSession.class);

    private final CompareApiClient apiClient;
    private final ClientResultStore store;

    private Sinks.One<Boolean> inFlight;

    public ComparisonSession(CompareApiClient apiClient, ClientResultStore store) {
        this.apiClient = apiClient;
        this.store = store;
    }

    public Mono<ComparisonResponse> submit(String prompt, List<String> modelIds) {
        return submit(new ComparisonRequest(prompt, modelIds));
    }

    public Mono<ComparisonResponse> submit(String prompt, List<String> modelIds, List<ConversationMessage> conversationHistory) {
        return submit(new ComparisonRequest(prompt, modelIds, conversationHistory));
    }

    public Mono<ComparisonResponse> submit(ComparisonRequest request) {
        return Mono.defer(() -> {
            Sinks.One<Boolean> abort = start();
            return apiClient.compare(request)
                    .takeUntilOther(abort.asMono())
                    .doOnNext(response -> installIfCurrent(abort, response))
                    .doFinally(signal -> release(abort));
        });
    }

    /**
     * Aborts the comparison in flight, if any.
     *
     * @return {@code true} if a comparison was aborted
     */
    public boolean cancel() {
        Sinks.One<Boolean> current;
        synchronized (this) {
            current = inFlight;
            inFlight = null;
        }
        if (current == null) {
            return false;
        }
        log.debug("Comparison cancelled by the user");
        current.tryEmitValue(Boolean.TRUE);
        return true;
    }

    public synchronized boolean inProgress() {
        return inFlight != null;
    }

    public ClientResultStore store() {
        return store;
    }

    private Sinks.One<Boolean> start() {
        Sinks.One<Boolean> abort = Sinks.one();
        Sinks.One<Boolean> previous;
        synchronized (this) {
            previous = inFlight;
            inFlight = abort;
            store.beginComparison();
        }
        if (previous != null) {
            log.debug("New comparison submitted, aborting the previous one");
            previous.tryEmitValue(Boolean.TRUE);
        }
        return abort;
    }

    private synchronized void installIfCurrent(Sinks.One<Boolean> abort, ComparisonResponse response) {
        if (inFlight == abort) {
            store.install(response);
        }
    }

    private synchronized void release(Sinks.One<Boolean> abort) {
        if (inFlight == abort) {
            inFlight = null;
        }
    }
}
