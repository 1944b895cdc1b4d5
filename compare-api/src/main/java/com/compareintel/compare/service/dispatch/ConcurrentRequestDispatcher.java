package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.config.ComparisonProperties;
import com.compareintel.compare.model.ComparisonRequest;
import com.compareintel.compare.model.ComparisonResponse;
import com.compareintel.compare.model.ConversationMessage;
import com.compareintel.compare.model.ModelResult;
import com.compareintel.compare.service.aggregation.ResultAggregator;
import com.compareintel.compare.service.aggregation.ResultCollector;
import com.compareintel.compare.service.normalization.ResponseNormalizer;
import com.compareintel.compare.service.provider.FailureClass;
import com.compareintel.compare.service.provider.ProviderPrompt;
import com.compareintel.compare.service.provider.RawOutcome;
import com.compareintel.compare.service.stats.ModelStatsTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a prompt out to every requested model on the shared provider-call scheduler and fans the results back in.
 * <p>
 * The scheduler's worker count is the global cap on concurrent provider calls; tasks beyond it wait as
 * {@code PENDING}. A model that fails or exceeds its deadline only affects its own entry. Cancelling the returned
 * {@link Mono} cancels every task of the comparison.
 */
@Service
public class ConcurrentRequestDispatcher implements RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentRequestDispatcher.class);
    private static final String REQUESTS_METRIC = "compare.requests";
    private static final String MODEL_CALLS_METRIC = "compare.model.calls";
    private static final String MODEL_LATENCY_METRIC = "compare.model.latency";

    private final ModelRegistry registry;
    private final ResponseNormalizer normalizer;
    private final ResultAggregator aggregator;
    private final ModelStatsTracker statsTracker;
    private final Scheduler providerCallScheduler;
    private final MeterRegistry meterRegistry;
    private final int maxModelsPerComparison;
    private final int maxPromptChars;
    private final int maxHistoryMessages;

    public ConcurrentRequestDispatcher(ModelRegistry registry,
                                       ResponseNormalizer normalizer,
                                       ResultAggregator aggregator,
                                       ModelStatsTracker statsTracker,
                                       @Qualifier("providerCallScheduler") Scheduler providerCallScheduler,
                                       MeterRegistry meterRegistry,
                                       ComparisonProperties properties) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.statsTracker = statsTracker;
        this.providerCallScheduler = providerCallScheduler;
        this.meterRegistry = meterRegistry;
        this.maxModelsPerComparison = properties.maxModelsPerComparison();
        this.maxPromptChars = properties.maxPromptChars();
        this.maxHistoryMessages = properties.maxHistoryMessages();
    }

    @Override
    public Mono<ComparisonResponse> dispatch(ComparisonRequest request) {
        return Mono.defer(() -> {
                    List<ModelBinding> bindings = resolve(request);
                    ProviderPrompt prompt = ProviderPrompt.withHistory(
                            request.prompt(), request.conversationHistory(), maxHistoryMessages);
                    if (prompt.omittedHistoryMessages() > 0) {
                        log.debug("Conversation history cut to the last {} of {} messages",
                                prompt.history().size(), request.conversationHistory().size());
                    }
                    long startedAt = System.nanoTime();
                    ResultCollector collector = aggregator.open(request.modelIds());
                    return Flux.fromIterable(bindings)
                            .flatMap(binding -> execute(binding, prompt).doOnNext(collector::record), bindings.size())
                            .then(Mono.fromCallable(() -> aggregator.aggregate(
                                    collector,
                                    request.prompt().length(),
                                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt))));
                })
                .doOnSuccess(this::recordCompleted)
                .doOnError(this::recordFailed)
                .doOnCancel(() -> {
                    log.info("Comparison cancelled before completion, releasing in-flight provider calls");
                    meterRegistry.counter(REQUESTS_METRIC, "outcome", "cancelled").increment();
                });
    }

    private Mono<ModelResult> execute(ModelBinding binding, ProviderPrompt prompt) {
        ProviderCall call = new ProviderCall(binding);
        return Mono.fromCallable(() -> call.run(prompt))
                .subscribeOn(providerCallScheduler)
                .timeout(call.deadline())
                .defaultIfEmpty(RawOutcome.failure(FailureClass.UNEXPECTED, null, "Adapter returned no outcome"))
                .onErrorResume(error -> Mono.just(outcomeFor(binding, error)))
                .map(outcome -> call.finish(normalizer.normalize(binding.modelId(), outcome, call.elapsedMillis())))
                .doOnNext(result -> log.debug("Model {} finished with {} in {} ms",
                        result.modelId(), result.status(), result.latencyMs()));
    }

    private RawOutcome outcomeFor(ModelBinding binding, Throwable error) {
        if (error instanceof TimeoutException) {
            log.warn("Model {} exceeded its {} deadline, call cancelled", binding.modelId(), binding.timeout());
            return RawOutcome.deadlineExceeded(binding.timeout());
        }
        if (error instanceof RejectedExecutionException) {
            log.error("Worker pool refused the call for model {}", binding.modelId(), error);
            return RawOutcome.failure(FailureClass.UNEXPECTED, null, "Provider call could not be scheduled");
        }
        log.error("Adapter for model {} failed unexpectedly", binding.modelId(), error);
        return RawOutcome.failure(FailureClass.UNEXPECTED, null, error.getMessage());
    }

    private List<ModelBinding> resolve(ComparisonRequest request) {
        String prompt = request.prompt();
        if (prompt == null || prompt.isBlank()) {
            throw new ComparisonValidationException("Input data cannot be empty");
        }
        List<String> modelIds = request.modelIds();
        if (modelIds == null || modelIds.isEmpty()) {
            throw new ComparisonValidationException("At least one model must be selected");
        }
        if (prompt.length() > maxPromptChars) {
            throw new ComparisonValidationException("Input exceeds the limit of " + maxPromptChars
                    + " characters. Current: " + prompt.length() + " characters.");
        }
        if (request.conversationHistory().stream().anyMatch(message -> message == null || !message.valid())) {
            throw new ComparisonValidationException("Conversation history messages need a role of "
                    + ConversationMessage.USER + " or " + ConversationMessage.ASSISTANT + " and content");
        }
        if (modelIds.size() > maxModelsPerComparison) {
            throw new ComparisonValidationException("A comparison allows at most " + maxModelsPerComparison
                    + " models. You selected " + modelIds.size() + " models.");
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        List<ModelBinding> bindings = new ArrayList<>(modelIds.size());
        for (String modelId : modelIds) {
            if (!seen.add(modelId)) {
                duplicates.add(modelId);
                continue;
            }
            registry.resolve(modelId).ifPresentOrElse(bindings::add, () -> unknown.add(String.valueOf(modelId)));
        }
        if (!duplicates.isEmpty()) {
            throw new ComparisonValidationException("Each model can only be selected once: " + String.join(", ", duplicates));
        }
        if (!unknown.isEmpty()) {
            throw new ComparisonValidationException("Unknown model ids: " + String.join(", ", unknown));
        }
        return bindings;
    }

    private void recordCompleted(ComparisonResponse response) {
        statsTracker.record(response);
        for (ModelResult result : response.results().values()) {
            meterRegistry.counter(MODEL_CALLS_METRIC, "model", result.modelId(), "status", result.status().name())
                    .increment();
            meterRegistry.timer(MODEL_LATENCY_METRIC, "model", result.modelId())
                    .record(Duration.ofMillis(result.latencyMs()));
        }
        meterRegistry.counter(REQUESTS_METRIC, "outcome", "completed").increment();
        log.info("Comparison of {} models finished in {} ms: {} succeeded, {} failed",
                response.metadata().requested(),
                response.metadata().processingTimeMs(),
                response.metadata().succeeded(),
                response.metadata().failed());
    }

    private void recordFailed(Throwable error) {
        if (error instanceof ComparisonValidationException) {
            log.debug("Rejected comparison request: {}", error.getMessage());
            meterRegistry.counter(REQUESTS_METRIC, "outcome", "rejected").increment();
            return;
        }
        log.error("Comparison failed", error);
        meterRegistry.counter(REQUESTS_METRIC, "outcome", "failed").increment();
    }
}
