package com.compareintel.compare.config;

import com.compareintel.compare.model.ModelDescriptor;
import com.compareintel.compare.service.provider.ProviderType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable comparison settings bound once at startup from {@code compare.*}.
 *
 * @param maxConcurrentCalls       size of the provider-call worker pool shared by every comparison in flight
 * @param maxModelsPerComparison   upper bound on {@code modelIds} per request
 * @param maxPromptChars           upper bound on prompt length
 * @param maxHistoryMessages       most recent conversation turns forwarded with a follow-up; older ones are dropped
 * @param systemPrompt             system instruction sent to every provider
 * @param providers                per-provider endpoint, credentials, timeout and retry settings
 * @param models                   selectable models
 */
@ConfigurationProperties(prefix = "compare")
public record ComparisonProperties(
        @DefaultValue("9") int maxConcurrentCalls,
        @DefaultValue("9") int maxModelsPerComparison,
        @DefaultValue("15000") int maxPromptChars,
        @DefaultValue("20") int maxHistoryMessages,
        @DefaultValue(ComparisonProperties.DEFAULT_SYSTEM_PROMPT) String systemPrompt,
        Map<ProviderType, ProviderSettings> providers,
        List<ModelDescriptor> models
) {

    static final String DEFAULT_SYSTEM_PROMPT = "Provide complete responses. Finish your thoughts and explanations fully.";

    public ComparisonProperties {
        maxConcurrentCalls = Math.max(1, maxConcurrentCalls);
        maxModelsPerComparison = Math.max(1, maxModelsPerComparison);
        maxPromptChars = Math.max(1, maxPromptChars);
        maxHistoryMessages = Math.max(0, maxHistoryMessages);
        systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        Map<ProviderType, ProviderSettings> copy = new EnumMap<>(ProviderType.class);
        if (providers != null) {
            copy.putAll(providers);
        }
        providers = Map.copyOf(copy);
        models = models == null ? List.of() : List.copyOf(models);
    }

    public ProviderSettings provider(ProviderType type) {
        return providers.getOrDefault(type, ProviderSettings.defaults(type));
    }
}
