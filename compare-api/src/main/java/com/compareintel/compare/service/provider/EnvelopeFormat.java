package com.compareintel.compare.service.provider;

/**
 * Shape of a successful provider payload, used to locate the generated text.
 */
public enum EnvelopeFormat {
    /** {@code choices[0].message.content} */
    OPENAI_CHAT,
    /** {@code content[*].text} for blocks of type {@code text} */
    ANTHROPIC_MESSAGES,
    /** {@code candidates[0].content.parts[*].text} */
    GEMINI_GENERATE,
    /** payload is a JSON string holding the text itself */
    PLAIN_TEXT
}
