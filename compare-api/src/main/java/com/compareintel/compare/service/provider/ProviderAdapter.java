package com.compareintel.compare.service.provider;

import com.compareintel.compare.model.ModelDescriptor;

import java.time.Duration;

/**
 * Submits one prompt to one external provider.
 * <p>
 * Implementations block the calling worker until the provider answers or {@code timeout} elapses, never throw for
 * provider-side failures and give up immediately when the calling thread is interrupted.
 */
public interface ProviderAdapter {

    ProviderType type();

    RawOutcome submit(ModelDescriptor model, ProviderPrompt prompt, Duration timeout);
}
