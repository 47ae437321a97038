package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * Immutable result of a speech-to-text call.
 *
 * <p>Empty text is valid here (silence may transcribe to nothing); the orchestrator decides
 * whether a transcript is usable.
 *
 * @param text         transcribed text (must not be null)
 * @param confidence   confidence between 0.0 and 1.0
 * @param languageCode language the audio was transcribed in (e.g. "de-DE")
 */
public record Transcript(String text, double confidence, String languageCode) {

    public Transcript {
        Objects.requireNonNull(text, "Transcript text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(languageCode, "Language code must not be null");
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * Text with leading and trailing whitespace removed.
     */
    public String cleanText() {
        return text.strip();
    }
}
