package com.compareintel.compare.service.provider;

import com.compareintel.compare.model.ModelDescriptor;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Offline provider returning a canned answer. Lets the UI and load tests run without provider credentials.
 */
@Component
public class MockProviderAdapter implements ProviderAdapter {

    @Override
    public ProviderType type() {
        return ProviderType.MOCK;
    }

    @Override
    public RawOutcome submit(ModelDescriptor model, ProviderPrompt prompt, Duration timeout) {
        String text = "This is a mock response from " + model.name() + ".\n\n"
                + "Your prompt was " + prompt.text().length() + " characters long"
                + (prompt.history().isEmpty() ? ". " : " and followed " + prompt.history().size() + " earlier messages. ")
                + "Configure real provider credentials to compare live model output.";
        return RawOutcome.success(EnvelopeFormat.PLAIN_TEXT, TextNode.valueOf(text));
    }
}
