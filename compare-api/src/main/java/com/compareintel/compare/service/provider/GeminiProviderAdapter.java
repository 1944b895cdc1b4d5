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
public class GeminiProviderAdapter extends HttpProviderAdapter {

    public GeminiProviderAdapter(@Qualifier("geminiWebClient") WebClient webClient,
                                 ComparisonProperties properties,
                                 ObjectMapper objectMapper) {
        super(ProviderType.GEMINI, webClient, properties.provider(ProviderType.GEMINI), properties.systemPrompt(), objectMapper);
    }

    @Override
    protected String path(ModelDescriptor model) {
        return "/v1beta/models/" + model.upstreamModel() + ":generateContent";
    }

    @Override
    protected Map<String, Object> requestBody(ModelDescriptor model, ProviderPrompt prompt) {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ConversationMessage turn : prompt.history()) {
            contents.add(content(ConversationMessage.ASSISTANT.equals(turn.role()) ? "model" : "user", turn.content()));
        }
        contents.add(content("user", prompt.text()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", prompt.systemInstruction(systemPrompt)))));
        payload.put("contents", contents);
        payload.put("generationConfig", Map.of("maxOutputTokens", model.maxOutputTokens()));
        return payload;
    }

    private Map<String, Object> content(String role, String text) {
        return Map.of("role", role, "parts", List.of(Map.of("text", text)));
    }

    @Override
    protected EnvelopeFormat envelope() {
        return EnvelopeFormat.GEMINI_GENERATE;
    }
}
