package com.phillippitts.talkback.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ordered concatenation of audio frames between a detected speech start and speech end,
 * prefixed with the pre-roll captured before speech was confirmed.
 *
 * <p>Created by the voice activity detector, consumed once by the turn orchestrator.
 *
 * @param samples          concatenated normalized samples, pre-roll first
 * @param sampleRate       sample rate in Hz
 * @param startMs          session-clock time of the first (pre-roll) sample
 * @param speechDurationMs time between the first and the last voiced frame
 */
public record SpeechSegment(float[] samples, int sampleRate, long startMs, long speechDurationMs) {

    public SpeechSegment {
        Objects.requireNonNull(samples, "samples must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (speechDurationMs < 0) {
            throw new IllegalArgumentException("speechDurationMs must not be negative");
        }
    }

    /**
     * Concatenates frames in order. All frames must share one sample rate.
     *
     * @param frames           frames to join (must not be empty)
     * @param speechDurationMs measured speech duration
     * @return new segment starting at the first frame's timestamp
     */
    public static SpeechSegment of(List<AudioFrame> frames, long speechDurationMs) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("frames must not be empty");
        }
        int sampleRate = frames.get(0).sampleRate();
        int total = 0;
        for (AudioFrame frame : frames) {
            if (frame.sampleRate() != sampleRate) {
                throw new IllegalArgumentException("Mixed sample rates in segment: "
                        + sampleRate + " and " + frame.sampleRate());
            }
            total += frame.sampleCount();
        }
        float[] joined = new float[total];
        int offset = 0;
        for (AudioFrame frame : frames) {
            System.arraycopy(frame.samples(), 0, joined, offset, frame.sampleCount());
            offset += frame.sampleCount();
        }
        return new SpeechSegment(joined, sampleRate, frames.get(0).timestampMs(), speechDurationMs);
    }

    /**
     * Total audio duration including pre-roll and trailing silence.
     */
    public long durationMs() {
        return samples.length * 1000L / sampleRate;
    }

    /**
     * Converts to 16-bit signed little-endian PCM, the format most speech-to-text services accept.
     */
    public byte[] toPcm16le() {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            short s = toInt16(samples[i]);
            out[2 * i] = (byte) (s & 0xFF);
            out[2 * i + 1] = (byte) ((s >> 8) & 0xFF);
        }
        return out;
    }

    private static short toInt16(float sample) {
        float clamped = Math.max(-1f, Math.min(1f, sample));
        return (short) Math.round(clamped * Short.MAX_VALUE);
    }
}
