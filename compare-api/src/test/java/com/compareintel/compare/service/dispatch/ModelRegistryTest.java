package com.compareintel.compare.service.dispatch;

import com.compareintel.compare.config.ComparisonProperties;
import com.compareintel.compare.config.ProviderSettings;
import com.compareintel.compare.model.ModelDescriptor;
import com.compareintel.compare.service.provider.MockProviderAdapter;
import com.compareintel.compare.service.provider.ProviderType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    @Test
    void resolvesConfiguredModelsWithProviderTimeout() {
        ComparisonProperties properties = properties(List.of(
                new ModelDescriptor("mock/echo", "Echo", ProviderType.MOCK, null, null, 100),
                new ModelDescriptor("mock/parrot", "Parrot", ProviderType.MOCK, null, null, 100)));

        ModelRegistry registry = new ModelRegistry(properties, List.of(new MockProviderAdapter()));

        ModelBinding binding = registry.resolve("mock/echo").orElseThrow();
        assertThat(binding.timeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(binding.adapter().type()).isEqualTo(ProviderType.MOCK);
        assertThat(registry.resolve("missing")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
        assertThat(registry.models()).extracting(ModelDescriptor::id).containsExactly("mock/echo", "mock/parrot");
        assertThat(registry.modelsByProvider()).containsOnlyKeys("MOCK");
        assertThat(registry.modelsByProvider().get("MOCK")).hasSize(2);
    }

    @Test
    void failsFastWhenAProviderHasNoAdapter() {
        ComparisonProperties properties = properties(List.of(
                new ModelDescriptor("openai/gpt-4o", null, ProviderType.OPENAI, null, null, 100)));

        assertThatThrownBy(() -> new ModelRegistry(properties, List.of(new MockProviderAdapter())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENAI");
    }

    @Test
    void failsFastOnDuplicateModelIds() {
        ComparisonProperties properties = properties(List.of(
                new ModelDescriptor("mock/echo", null, ProviderType.MOCK, null, null, 100),
                new ModelDescriptor("mock/echo", null, ProviderType.MOCK, null, null, 200)));

        assertThatThrownBy(() -> new ModelRegistry(properties, List.of(new MockProviderAdapter())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("more than once");
    }

    private ComparisonProperties properties(List<ModelDescriptor> models) {
        return new ComparisonProperties(9, 9, 15000, 20, null,
                Map.of(ProviderType.MOCK, new ProviderSettings(null, null, Duration.ofSeconds(3), null, null)),
                models);
    }
}
