package com.compareintel.compare.model;

import com.compareintel.compare.service.provider.ProviderType;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * A selectable model as configured under {@code compare.models}.
 *
 * @param id              stable client-facing key, e.g. {@code anthropic/claude-sonnet-4.5}
 * @param name            display name
 * @param provider        adapter that serves the model
 * @param upstreamModel   the provider's own model name; defaults to {@code id}
 * @param description     short catalog blurb
 * @param maxOutputTokens generation cap sent to the provider
 */
public record ModelDescriptor(
        String id,
        String name,
        ProviderType provider,
        String upstreamModel,
        String description,
        @DefaultValue("4000") int maxOutputTokens
) {

    public ModelDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Model " + id + " has no provider");
        }
        name = name == null || name.isBlank() ? id : name;
        upstreamModel = upstreamModel == null || upstreamModel.isBlank() ? id : upstreamModel;
        description = description == null ? "" : description;
        maxOutputTokens = Math.max(1, maxOutputTokens);
    }
}
