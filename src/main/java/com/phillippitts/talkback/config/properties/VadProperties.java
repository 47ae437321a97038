package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the voice activity detector ({@code talkback.vad.*}).
 */
@Validated
@ConfigurationProperties(prefix = "talkback.vad")
public class VadProperties {

    @Positive
    private final int sampleRate;

    /** Consecutive voiced frames needed to enter the speaking state. */
    @Min(1)
    private final int minVoiceFrames;

    /** Consecutive silent frames needed (together with the silence threshold) to end speech. */
    @Min(1)
    private final int minSilenceFrames;

    @Min(0)
    private final int silenceThresholdMs;

    /** Bursts shorter than this are dropped without a flush. */
    @Min(0)
    private final int minSpeechDurationMs;

    /** Frames kept from before speech onset. */
    @Min(0)
    private final int preRollFrames;

    /** Longest segment a session lets accumulate before forcing a flush; 0 disables. */
    @Min(0)
    private final int maxSegmentDurationMs;

    /** Frame RMS (normalized samples) at or above which a frame counts as voiced. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double rmsThreshold;

    @ConstructorBinding
    public VadProperties(Integer sampleRate,
                         Integer minVoiceFrames,
                         Integer minSilenceFrames,
                         Integer silenceThresholdMs,
                         Integer minSpeechDurationMs,
                         Integer preRollFrames,
                         Integer maxSegmentDurationMs,
                         Double rmsThreshold) {
        this.sampleRate = sampleRate == null ? 48_000 : sampleRate;
        this.minVoiceFrames = minVoiceFrames == null ? 3 : minVoiceFrames;
        this.minSilenceFrames = minSilenceFrames == null ? 5 : minSilenceFrames;
        this.silenceThresholdMs = silenceThresholdMs == null ? 200 : silenceThresholdMs;
        this.minSpeechDurationMs = minSpeechDurationMs == null ? 300 : minSpeechDurationMs;
        this.preRollFrames = preRollFrames == null ? 50 : preRollFrames;
        this.maxSegmentDurationMs = maxSegmentDurationMs == null ? 30_000 : maxSegmentDurationMs;
        this.rmsThreshold = rmsThreshold == null ? 0.02 : rmsThreshold;
    }

    /**
     * All defaults; used by tests and by code that runs without Spring.
     */
    public static VadProperties defaults() {
        return new VadProperties(null, null, null, null, null, null, null, null);
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public int getMinVoiceFrames() {
        return minVoiceFrames;
    }

    public int getMinSilenceFrames() {
        return minSilenceFrames;
    }

    public int getSilenceThresholdMs() {
        return silenceThresholdMs;
    }

    public int getMinSpeechDurationMs() {
        return minSpeechDurationMs;
    }

    public int getPreRollFrames() {
        return preRollFrames;
    }

    public int getMaxSegmentDurationMs() {
        return maxSegmentDurationMs;
    }

    public double getRmsThreshold() {
        return rmsThreshold;
    }
}
