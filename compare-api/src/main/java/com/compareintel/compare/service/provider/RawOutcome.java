package com.compareintel.compare.service.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Objects;

/**
 * What a provider call produced: either a success payload in a known envelope or a classified failure.
 */
public record RawOutcome(EnvelopeFormat format,
                         JsonNode payload,
                         FailureClass failure,
                         Integer httpStatus,
                         String detail) {

    public static RawOutcome success(EnvelopeFormat format, JsonNode payload) {
        return new RawOutcome(Objects.requireNonNull(format, "format"), payload, null, null, null);
    }

    public static RawOutcome failure(FailureClass failure, Integer httpStatus, String detail) {
        return new RawOutcome(null, null, Objects.requireNonNull(failure, "failure"), httpStatus, detail);
    }

    public static RawOutcome deadlineExceeded(Duration timeout) {
        return failure(FailureClass.DEADLINE_EXCEEDED, null, formatDuration(timeout));
    }

    public boolean successful() {
        return failure == null;
    }

    static String formatDuration(Duration duration) {
        if (duration == null) {
            return "unknown";
        }
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }
}
