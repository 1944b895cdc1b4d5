package com.compareintel.compare.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param conversationHistory earlier turns for a follow-up comparison, oldest first; empty for a fresh one
 */
public record ComparisonRequest(
        @NotBlank String prompt,
        @NotEmpty List<String> modelIds,
        List<@Valid ConversationMessage> conversationHistory
) {

    public ComparisonRequest {
        conversationHistory = conversationHistory == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(conversationHistory));
    }

    public ComparisonRequest(String prompt, List<String> modelIds) {
        this(prompt, modelIds, List.of());
    }
}
