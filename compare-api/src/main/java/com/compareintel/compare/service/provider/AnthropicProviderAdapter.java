package com.compareintel.compare.service.provider;

import com.compareintel.compare.config.ComparisonProperties;
import com.compareintel.compare.model.ConversationMessage;
import com.compareintel.compare.model.ModelDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnthropicProviderAdapter extends HttpProviderAdapter {

    public AnthropicProviderAdapter(@Qualifier("anthropicWebClient") WebClient webClient,
                                    ComparisonProperties properties,
                                    ObjectMapper objectMapper) {
        super(ProviderType.ANTHROPIC, webClient, properties.provider(ProviderType.ANTHROPIC), properties.systemPrompt(), objectMapper);
    }

    @Override
    protected String path(ModelDescriptor model) {
        return "/v1/messages";
    }

    @Override
    protected Map<String, Object> requestBody(ModelDescriptor model, ProviderPrompt prompt) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ConversationMessage turn : prompt.history()) {
            messages.add(Map.of("role", turn.role(), "content", turn.content()));
        }
        messages.add(Map.of("role", "user", "content", prompt.text()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.upstreamModel());
        payload.put("max_tokens", model.maxOutputTokens());
        payload.put("system", prompt.systemInstruction(systemPrompt));
        payload.put("messages", messages);
        return payload;
    }

    @Override
    protected EnvelopeFormat envelope() {
        return EnvelopeFormat.ANTHROPIC_MESSAGES;
    }
}
