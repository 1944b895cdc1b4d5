package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.model.ModelDescriptor;
import com.compareintel.compare.service.provider.ProviderAdapter;

import java.time.Duration;

public record ModelBinding(ModelDescriptor model, ProviderAdapter adapter, Duration timeout) {

    public String modelId() {
        return model.id();
    }
}
