package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.config.ComparisonProperties;
import com.compareintel.compare.model.ModelDescriptor;
import com.compareintel.compare.service.provider.ProviderAdapter;
import com.compareintel.compare.service.provider.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves model ids to the adapter and deadline that serve them. Built once from configuration.
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelBinding> bindings;

    public ModelRegistry(ComparisonProperties properties, List<ProviderAdapter> adapters) {
        Map<ProviderType, ProviderAdapter> adaptersByType = new EnumMap<>(ProviderType.class);
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = adaptersByType.put(adapter.type(), adapter);
            if (previous != null) {
                throw new IllegalStateException("More than one adapter registered for provider " + adapter.type());
            }
        }
        Map<String, ModelBinding> resolved = new LinkedHashMap<>();
        for (ModelDescriptor model : properties.models()) {
            ProviderAdapter adapter = adaptersByType.get(model.provider());
            if (adapter == null) {
                throw new IllegalStateException("No adapter registered for provider " + model.provider() + " used by model " + model.id());
            }
            ModelBinding binding = new ModelBinding(model, adapter, properties.provider(model.provider()).timeout());
            if (resolved.putIfAbsent(model.id(), binding) != null) {
                throw new IllegalStateException("Model " + model.id() + " is configured more than once");
            }
        }
        this.bindings = Collections.unmodifiableMap(resolved);
        log.info("Registered {} models across providers {}", bindings.size(), adaptersByType.keySet());
    }

    public Optional<ModelBinding> resolve(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(bindings.get(modelId));
    }

    public List<ModelDescriptor> models() {
        return bindings.values().stream()
                .map(ModelBinding::model)
                .toList();
    }

    public Map<String, List<ModelDescriptor>> modelsByProvider() {
        Map<String, List<ModelDescriptor>> grouped = new LinkedHashMap<>();
        for (ModelBinding binding : bindings.values()) {
            grouped.computeIfAbsent(binding.model().provider().name(), key -> new ArrayList<>()).add(binding.model());
        }
        grouped.replaceAll((provider, models) -> List.copyOf(models));
        return Collections.unmodifiableMap(grouped);
    }
}
