package com.compareintel.compare.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * One earlier turn of a follow-up comparison, sent back by the client as context.
 *
 * @param role    {@code user} or {@code assistant}
 * @param content the turn's text as originally shown
 */
public record ConversationMessage(
        @NotNull @Pattern(regexp = "user|assistant") String role,
        @NotNull String content
) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ConversationMessage user(String content) {
        return new ConversationMessage(USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(ASSISTANT, content);
    }

    public boolean valid() {
        return (USER.equals(role) || ASSISTANT.equals(role)) && content != null;
    }
}
