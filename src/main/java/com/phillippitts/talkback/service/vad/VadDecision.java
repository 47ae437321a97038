package com.phillippitts.talkback.service.vad;

import com.phillippitts.talkback.domain.SpeechSegment;

import java.util.Objects;

/**
 * Result of feeding one frame to the {@link VoiceActivityDetector}.
 *
 * @param shouldFlush {@code true} when a speech segment just ended
 * @param segment     the finished segment when {@code shouldFlush}, otherwise {@code null}
 */
public record VadDecision(boolean shouldFlush, SpeechSegment segment) {

    public static final VadDecision NONE = new VadDecision(false, null);

    public VadDecision {
        if (shouldFlush) {
            Objects.requireNonNull(segment, "segment must not be null when flushing");
        } else if (segment != null) {
            throw new IllegalArgumentException("segment must be null when not flushing");
        }
    }

    public static VadDecision flush(SpeechSegment segment) {
        return new VadDecision(true, segment);
    }
}
