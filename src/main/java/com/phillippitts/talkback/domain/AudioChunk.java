package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * Synthesized audio for (part of) one text span, paired with the span text for client display.
 *
 * @param samples    signed 16-bit mono samples
 * @param sampleRate sample rate in Hz
 * @param text       span text that produced these samples
 */
public record AudioChunk(short[] samples, int sampleRate, String text) {

    public AudioChunk {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    public long durationMs() {
        return samples.length * 1000L / sampleRate;
    }
}
