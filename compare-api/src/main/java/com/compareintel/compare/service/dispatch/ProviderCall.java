package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.model.ModelResult;
import com.compareintel.compare.model.ResultStatus;
import com.compareintel.compare.service.provider.ProviderPrompt;
import com.compareintel.compare.service.provider.RawOutcome;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One model's task within a comparison: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED | TIMED_OUT}.
 * A task the worker pool never accepted goes straight from {@code PENDING} to {@code FAILED}.
 * The deadline only starts ticking once a worker picks the task up.
 */
final class ProviderCall {

    enum State {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    private final ModelBinding binding;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private final Sinks.One<Long> started = Sinks.one();
    private volatile long startedAtNanos;

    ProviderCall(ModelBinding binding) {
        this.binding = binding;
    }

    RawOutcome run(ProviderPrompt prompt) {
        if (!state.compareAndSet(State.PENDING, State.RUNNING)) {
            throw new IllegalStateException("Call for " + binding.modelId() + " already started, state " + state.get());
        }
        startedAtNanos = System.nanoTime();
        started.tryEmitValue(startedAtNanos);
        return binding.adapter().submit(binding.model(), prompt, binding.timeout());
    }

    /**
     * Emits once the configured timeout has elapsed after the call started running.
     */
    Mono<Long> deadline() {
        return started.asMono().flatMap(ignored -> Mono.delay(binding.timeout()));
    }

    ModelResult finish(ModelResult result) {
        State terminal = switch (result.status()) {
            case SUCCEEDED -> State.SUCCEEDED;
            case FAILED -> State.FAILED;
            case TIMED_OUT -> State.TIMED_OUT;
        };
        boolean moved = state.compareAndSet(State.RUNNING, terminal)
                || (result.status() == ResultStatus.FAILED && state.compareAndSet(State.PENDING, terminal));
        if (!moved) {
            throw new IllegalStateException("Call for " + binding.modelId() + " cannot move from " + state.get() + " to " + terminal);
        }
        return result;
    }

    long elapsedMillis() {
        if (state.get() == State.PENDING) {
            return 0;
        }
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }

    State state() {
        return state.get();
    }

    ModelBinding binding() {
        return binding;
    }
}
