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

/**
 * OpenAI-compatible chat completions. Also serves OpenRouter and local gateways that mimic the API.
 */
@Component
public class OpenAiProviderAdapter extends HttpProviderAdapter {

    public OpenAiProviderAdapter(@Qualifier("openAiWebClient") WebClient webClient,
                                 ComparisonProperties properties,
                                 ObjectMapper objectMapper) {
        super(ProviderType.OPENAI, webClient, properties.provider(ProviderType.OPENAI), properties.systemPrompt(), objectMapper);
    }

    @Override
    protected String path(ModelDescriptor model) {
        return "/v1/chat/completions";
    }

    @Override
    protected Map<String, Object> requestBody(ModelDescriptor model, ProviderPrompt prompt) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", prompt.systemInstruction(systemPrompt)));
        for (ConversationMessage turn : prompt.history()) {
            messages.add(Map.of("role", turn.role(), "content", turn.content()));
        }
        messages.add(Map.of("role", "user", "content", prompt.text()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.upstreamModel());
        payload.put("messages", messages);
        payload.put("max_tokens", model.maxOutputTokens());
        payload.put("stream", Boolean.FALSE);
        return payload;
    }

    @Override
    protected EnvelopeFormat envelope() {
        return EnvelopeFormat.OPENAI_CHAT;
    }
}
