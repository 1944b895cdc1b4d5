package com.compareintel.compare.config;

import com.compareintel.compare.service.provider.ProviderType;

import java.time.Duration;

/**
 * Connection settings for one provider.
 *
 * @param baseUrl        API root; defaults to the provider's public endpoint
 * @param apiKey         credential; blank means the provider is not usable
 * @param timeout        per-call deadline, retries included
 * @param maxAttempts    attempts for rate-limited and 5xx replies, first call included
 * @param initialBackoff first retry delay, doubled on each further attempt
 */
public record ProviderSettings(
        String baseUrl,
        String apiKey,
        Duration timeout,
        Integer maxAttempts,
        Duration initialBackoff
) {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(500);

    public ProviderSettings {
        apiKey = apiKey == null ? "" : apiKey.trim();
        timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? DEFAULT_TIMEOUT : timeout;
        maxAttempts = maxAttempts == null ? 3 : Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? DEFAULT_BACKOFF : initialBackoff;
    }

    public static ProviderSettings defaults(ProviderType type) {
        return new ProviderSettings(type.defaultBaseUrl(), "", null, null, null);
    }

    public String resolvedBaseUrl(ProviderType type) {
        return baseUrl == null || baseUrl.isBlank() ? type.defaultBaseUrl() : baseUrl;
    }

    public boolean hasApiKey() {
        return !apiKey.isBlank();
    }
}
