package com.phillippitts.talkback.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Descriptive data attached to a registered turn.
 *
 * @param sessionId  originating session (may be {@code null} for turns started outside a session)
 * @param language   language code used for transcription
 * @param voice      synthesis voice
 * @param attributes free-form client metadata, copied defensively
 */
public record TurnMetadata(String sessionId, String language, String voice, Map<String, String> attributes) {

    public TurnMetadata {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static TurnMetadata of(String sessionId, String language, String voice) {
        return new TurnMetadata(sessionId, language, voice, Map.of());
    }
}
