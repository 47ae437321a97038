package com.phillippitts.talkback.service.vad;

import com.phillippitts.talkback.config.properties.VadProperties;
import com.phillippitts.talkback.domain.AudioFrame;
import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Frame-by-frame speech boundary detector with hysteresis and pre-roll.
 *
 * <p><b>States:</b>
 * <pre>
 * IDLE → SPEAKING   after minVoiceFrames consecutive voiced frames
 * SPEAKING → IDLE   after minSilenceFrames consecutive silent frames whose silence
 *                   (time since the end of the last voiced frame) reaches silenceThresholdMs;
 *                   flushes a segment when speech lasted at least minSpeechDurationMs,
 *                   otherwise drops it
 * </pre>
 *
 * <p>While idle only the last {@code preRollFrames} frames plus the current voiced run are kept,
 * so the segment starts with up to {@code preRollFrames} frames captured before speech onset.
 * While speaking the buffer grows without bound; the owning session caps segment length.
 *
 * <p>Timing uses frame timestamps, not the wall clock, so replayed audio behaves like live audio.
 *
 * <p><b>Thread Safety:</b> not thread-safe. One instance belongs to one session and is driven only
 * by that session's inbound message handling.
 */
public final class VoiceActivityDetector {

    private static final Logger LOG = LogManager.getLogger(VoiceActivityDetector.class);

    private final VoiceActivityClassifier classifier;
    private final TurnMetricsPublisher metrics;
    private final int minVoiceFrames;
    private final int minSilenceFrames;
    private final long silenceThresholdMs;
    private final long minSpeechDurationMs;
    private final int preRollFrames;

    private final Deque<AudioFrame> buffer = new ArrayDeque<>();
    private boolean speaking;
    private int voiceCount;
    private int silenceCount;
    private long candidateStartMs;
    private long firstVoiceMs;
    private long lastVoiceEndMs;
    private long classifierFailures;

    public VoiceActivityDetector(VoiceActivityClassifier classifier, VadProperties properties) {
        this(classifier, properties, TurnMetricsPublisher.NOOP);
    }

    public VoiceActivityDetector(VoiceActivityClassifier classifier,
                                 VadProperties properties,
                                 TurnMetricsPublisher metrics) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.minVoiceFrames = properties.getMinVoiceFrames();
        this.minSilenceFrames = properties.getMinSilenceFrames();
        this.silenceThresholdMs = properties.getSilenceThresholdMs();
        this.minSpeechDurationMs = properties.getMinSpeechDurationMs();
        this.preRollFrames = properties.getPreRollFrames();
    }

    /**
     * Feeds one frame.
     *
     * @param frame next frame in arrival order
     * @return {@link VadDecision#NONE}, or a flush carrying the finished segment
     */
    public VadDecision process(AudioFrame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        boolean voiced = classify(frame);
        buffer.addLast(frame);

        if (voiced) {
            silenceCount = 0;
            voiceCount++;
            if (voiceCount == 1 && !speaking) {
                candidateStartMs = frame.timestampMs();
            }
            lastVoiceEndMs = frame.endTimestampMs();
            if (!speaking) {
                if (voiceCount >= minVoiceFrames) {
                    speaking = true;
                    firstVoiceMs = candidateStartMs;
                    LOG.debug("Speech started at {} ms (pre-roll frames kept: {})",
                            firstVoiceMs, buffer.size() - voiceCount);
                } else {
                    trimIdleBuffer();
                }
            }
            return VadDecision.NONE;
        }

        voiceCount = 0;
        silenceCount++;
        if (!speaking) {
            trimIdleBuffer();
            return VadDecision.NONE;
        }

        long silenceMs = frame.endTimestampMs() - lastVoiceEndMs;
        if (silenceCount < minSilenceFrames || silenceMs < silenceThresholdMs) {
            return VadDecision.NONE;
        }

        long speechMs = lastVoiceEndMs - firstVoiceMs;
        if (speechMs < minSpeechDurationMs) {
            LOG.debug("Speech burst too short ({} ms < {} ms); dropped", speechMs, minSpeechDurationMs);
            metrics.recordVadSegment(false);
            resetToIdle();
            return VadDecision.NONE;
        }
        SpeechSegment segment = SpeechSegment.of(new ArrayList<>(buffer), speechMs);
        LOG.debug("Speech ended: speech={} ms, segment={} ms, frames={}",
                speechMs, segment.durationMs(), buffer.size());
        metrics.recordVadSegment(true);
        resetToIdle();
        return VadDecision.flush(segment);
    }

    /**
     * Ends the current segment regardless of silence, e.g. when the client stops sending
     * audio or the session closes.
     *
     * <p>Returns the buffered segment when speaking and the speech lasted long enough.
     * Always resets to idle, so a second call returns empty.
     */
    public Optional<SpeechSegment> forceFlush() {
        if (!speaking) {
            resetToIdle();
            return Optional.empty();
        }
        long speechMs = lastVoiceEndMs - firstVoiceMs;
        if (speechMs < minSpeechDurationMs) {
            metrics.recordVadSegment(false);
            resetToIdle();
            return Optional.empty();
        }
        SpeechSegment segment = SpeechSegment.of(new ArrayList<>(buffer), speechMs);
        metrics.recordVadSegment(true);
        resetToIdle();
        LOG.debug("Forced flush: speech={} ms, segment={} ms", speechMs, segment.durationMs());
        return Optional.of(segment);
    }

    /**
     * Discards all buffered audio and returns to idle.
     */
    public void reset() {
        resetToIdle();
    }

    public boolean isSpeaking() {
        return speaking;
    }

    /**
     * Audio currently held, pre-roll included.
     */
    public long bufferedDurationMs() {
        long total = 0;
        for (AudioFrame frame : buffer) {
            total += frame.durationMs();
        }
        return total;
    }

    int bufferedFrames() {
        return buffer.size();
    }

    public long getClassifierFailures() {
        return classifierFailures;
    }

    private boolean classify(AudioFrame frame) {
        try {
            return classifier.isVoiced(frame);
        } catch (RuntimeException e) {
            classifierFailures++;
            LOG.warn("Voice classification failed; frame at {} ms treated as silence: {}",
                    frame.timestampMs(), e.getMessage());
            return false;
        }
    }

    private void trimIdleBuffer() {
        int keep = preRollFrames + voiceCount;
        while (buffer.size() > keep) {
            buffer.removeFirst();
        }
    }

    private void resetToIdle() {
        buffer.clear();
        speaking = false;
        voiceCount = 0;
        silenceCount = 0;
        candidateStartMs = 0;
        firstVoiceMs = 0;
        lastVoiceEndMs = 0;
    }
}
