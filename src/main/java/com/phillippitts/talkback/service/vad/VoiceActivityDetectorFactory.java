package com.phillippitts.talkback.service.vad;

import com.phillippitts.talkback.config.properties.VadProperties;
import com.phillippitts.talkback.service.metrics.TurnMetricsPublisher;

/**
 * Creates one detector per session around the shared classifier.
 */
public class VoiceActivityDetectorFactory {

    private final VoiceActivityClassifier classifier;
    private final VadProperties properties;
    private final TurnMetricsPublisher metrics;

    public VoiceActivityDetectorFactory(VoiceActivityClassifier classifier,
                                        VadProperties properties,
                                        TurnMetricsPublisher metrics) {
        this.classifier = classifier;
        this.properties = properties;
        this.metrics = metrics;
    }

    public VoiceActivityDetector create() {
        return new VoiceActivityDetector(classifier, properties, metrics);
    }

    public VadProperties getProperties() {
        return properties;
    }
}
