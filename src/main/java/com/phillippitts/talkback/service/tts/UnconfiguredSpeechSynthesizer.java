package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.stream.PullStream;

/**
 * Placeholder installed when no speech synthesis adapter bean is present.
 */
public final class UnconfiguredSpeechSynthesizer implements SpeechSynthesizer {

    public static final String NAME = "unconfigured";

    @Override
    public PullStream<AudioChunk> synthesize(String text, String voice, CancellationToken token) {
        throw new SynthesisException("No speech synthesis adapter configured", text);
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
