package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * Non-empty, trimmed piece of generated text chosen as one synthesis unit.
 *
 * @param text     span text, never blank
 * @param index    zero-based position of the span within its turn
 * @param boundary the kind of boundary the span was cut at
 */
public record SynthesizableSpan(String text, int index, Boundary boundary) {

    /**
     * Boundary quality, best first.
     */
    public enum Boundary {
        /** Cut after {@code . ! ?} or a newline. */
        SENTENCE,
        /** Cut after {@code , ; :} or a spaced dash. */
        CLAUSE,
        /** Length fallback, cut between two words. */
        WORD,
        /** Remainder flushed when the fragment stream ended. */
        FINAL
    }

    public SynthesizableSpan {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("span text must not be blank");
        }
        Objects.requireNonNull(boundary, "boundary must not be null");
    }
}
