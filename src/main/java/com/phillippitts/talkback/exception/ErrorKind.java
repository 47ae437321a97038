package com.phillippitts.talkback.exception;

import java.util.Locale;

/**
 * Closed set of failure categories reported to session clients.
 *
 * <p>The wire name is part of the session protocol and must stay stable across releases.
 */
public enum ErrorKind {
    TRANSCRIPTION("transcription_failed"),
    GENERATION("generation_failed"),
    SYNTHESIS("synthesis_failed"),
    VALIDATION("validation"),
    TURN_CONFLICT("turn_conflict"),
    PROTOCOL("protocol"),
    INTERNAL("internal");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Lower-case tag value for metrics.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
