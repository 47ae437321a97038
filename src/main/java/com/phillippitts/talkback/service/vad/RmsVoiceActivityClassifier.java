package com.phillippitts.talkback.service.vad;

import com.phillippitts.talkback.domain.AudioFrame;

/**
 * Energy-based classifier: a frame is voiced when its RMS amplitude reaches the threshold.
 *
 * <p>Samples are normalized to [-1, 1], so a threshold of 0.02 corresponds to an RMS of
 * roughly 650 on the 16-bit scale.
 */
public final class RmsVoiceActivityClassifier implements VoiceActivityClassifier {

    private final double threshold;

    public RmsVoiceActivityClassifier(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean isVoiced(AudioFrame frame) {
        if (frame.sampleCount() == 0) {
            return false;
        }
        return rms(frame.samples()) >= threshold;
    }

    /**
     * Root mean square amplitude of normalized samples.
     *
     * @return RMS in [0, 1]; 0 for an empty array
     */
    static double rms(float[] samples) {
        if (samples.length == 0) {
            return 0;
        }
        double sumSquares = 0;
        for (float sample : samples) {
            sumSquares += (double) sample * sample;
        }
        return Math.sqrt(sumSquares / samples.length);
    }
}
