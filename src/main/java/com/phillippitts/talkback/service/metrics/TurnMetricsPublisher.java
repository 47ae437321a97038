package com.phillippitts.talkback.service.metrics;

import com.phillippitts.talkback.domain.TurnState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link TurnMetrics} used by the detector, orchestrator and sessions.
 *
 * <p>{@link #NOOP} lets those classes run without a meter registry (unit tests, tooling).
 *
 * @see TurnMetrics
 */
@Component
public final class TurnMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TurnMetricsPublisher.class);

    /**
     * Shared instance that records nothing and never throws.
     */
    public static final TurnMetricsPublisher NOOP = new TurnMetricsPublisher(null);

    private final TurnMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public TurnMetricsPublisher(TurnMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TurnMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurnFinished(TurnState state, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordTurn(state.name().toLowerCase(Locale.ROOT), durationNanos);
    }

    public void recordFirstAudio(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordFirstAudio(durationNanos);
    }

    public void recordSpanFailure() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSpanFailure();
    }

    public void recordVadSegment(boolean flushed) {
        if (metrics == null) {
            return;
        }
        metrics.incrementVadSegment(flushed ? "flushed" : "dropped");
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
