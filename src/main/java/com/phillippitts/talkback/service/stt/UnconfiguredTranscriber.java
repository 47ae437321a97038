package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.domain.Transcript;
import com.phillippitts.talkback.exception.TranscriptionExceptionBuilder;

/**
 * Placeholder installed when no speech-to-text adapter bean is present.
 * Every call fails with a typed error so audio turns end with {@code transcription_failed}.
 */
public final class UnconfiguredTranscriber implements Transcriber {

    public static final String NAME = "unconfigured";

    @Override
    public Transcript transcribe(SpeechSegment segment, String languageCode) {
        throw TranscriptionExceptionBuilder.create("No speech-to-text adapter configured")
                .adapter(NAME)
                .language(languageCode)
                .segment(segment)
                .build();
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
