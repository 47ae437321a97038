package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * One block of mono PCM samples as received from a session, normalized to floats in [-1, 1].
 *
 * <p>Frames are ephemeral: the voice activity detector owns them for one detection cycle and
 * either drops them or concatenates them into a {@link SpeechSegment}. The sample array is not
 * copied; callers must not mutate it after handing the frame over.
 *
 * @param samples     normalized mono samples (must not be null)
 * @param sampleRate  sample rate in Hz (must be positive)
 * @param timestampMs arrival time of the first sample, in milliseconds on the session clock
 */
public record AudioFrame(float[] samples, int sampleRate, long timestampMs) {

    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
    }

    /**
     * Duration covered by this frame in milliseconds (truncated).
     */
    public long durationMs() {
        return samples.length * 1000L / sampleRate;
    }

    /**
     * Session-clock time just after the last sample of this frame.
     */
    public long endTimestampMs() {
        return timestampMs + durationMs();
    }

    public int sampleCount() {
        return samples.length;
    }
}
