package com.phillippitts.talkback.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for turns, synthesis spans and speech segmentation.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class TurnMetrics {

    private static final String METRIC_PREFIX = "talkback";

    private final MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end turn latency and counts the outcome.
     *
     * @param outcome       lower-case terminal state (completed, cancelled, failed, rejected)
     * @param durationNanos time from registration to cleanup
     */
    public void recordTurn(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time from turn start to turn end")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".turn.outcome")
                .description("Number of finished turns by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records time from turn start to the first audio chunk handed to the session.
     */
    public void recordFirstAudio(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.first_audio")
                .description("Time until the first synthesized audio of a turn")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSpanFailure() {
        Counter.builder(METRIC_PREFIX + ".span.failure")
                .description("Number of text spans whose synthesis failed and was skipped")
                .register(registry)
                .increment();
    }

    /**
     * @param result flushed or dropped
     */
    public void incrementVadSegment(String result) {
        Counter.builder(METRIC_PREFIX + ".vad.segment")
                .description("Speech segments ended by the voice activity detector")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
