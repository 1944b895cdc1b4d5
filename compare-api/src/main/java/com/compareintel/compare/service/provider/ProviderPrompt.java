package com.compareintel.compare.service.provider;

import com.compareintel.compare.model.ConversationMessage;

import java.util.List;

/**
 * What a provider is asked: the new prompt plus the most recent turns of the conversation it follows up on.
 *
 * @param text                   the prompt being compared
 * @param history                retained earlier turns, oldest first
 * @param omittedHistoryMessages older turns dropped to stay within the history cap
 */
public record ProviderPrompt(String text, List<ConversationMessage> history, int omittedHistoryMessages) {

    public ProviderPrompt {
        history = history == null ? List.of() : List.copyOf(history);
        omittedHistoryMessages = Math.max(0, omittedHistoryMessages);
    }

    public static ProviderPrompt of(String text) {
        return new ProviderPrompt(text, List.of(), 0);
    }

    /**
     * Keeps only the last {@code maxHistoryMessages} turns of {@code history}.
     */
    public static ProviderPrompt withHistory(String text, List<ConversationMessage> history, int maxHistoryMessages) {
        if (history == null || history.isEmpty()) {
            return of(text);
        }
        int keep = Math.min(history.size(), Math.max(0, maxHistoryMessages));
        return new ProviderPrompt(text, history.subList(history.size() - keep, history.size()), history.size() - keep);
    }

    /**
     * The system instruction for this prompt, noting dropped turns when the history was cut.
     */
    public String systemInstruction(String systemPrompt) {
        if (omittedHistoryMessages == 0) {
            return systemPrompt;
        }
        return systemPrompt + "\n\nNote: Earlier conversation context (" + omittedHistoryMessages
                + " messages) has been omitted to focus on recent discussion.";
    }
}
