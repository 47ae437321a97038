package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.exception.GenerationException;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.stream.PullStream;

/**
 * Placeholder installed when no text generation adapter bean is present.
 */
public final class UnconfiguredTextGenerator implements TextGenerator {

    public static final String NAME = "unconfigured";

    @Override
    public PullStream<String> generate(String prompt, CancellationToken token) {
        throw new GenerationException("No text generation adapter configured");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
