package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.domain.SynthesizableSpan;
import com.phillippitts.talkback.domain.Transcript;

/**
 * Element of a {@link TurnStream}: the transcript of an audio turn, then audio chunks in span order.
 */
public interface TurnEvent {

    /**
     * Transcript of an audio turn; always the first event of such a turn.
     */
    record Transcribed(Transcript transcript) implements TurnEvent {
    }

    /**
     * One synthesized chunk.
     *
     * @param chunkNumber 1-based, consecutive within the turn
     * @param chunk       audio and span text
     * @param span        span that produced the chunk
     * @param spanStart   {@code true} for the first chunk of its span
     */
    record Audio(int chunkNumber, AudioChunk chunk, SynthesizableSpan span, boolean spanStart) implements TurnEvent {
    }
}
