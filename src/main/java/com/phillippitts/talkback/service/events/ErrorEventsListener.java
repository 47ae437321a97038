package com.phillippitts.talkback.service.events;

import com.phillippitts.talkback.domain.TurnState;
import com.phillippitts.talkback.service.orchestration.event.TurnFinishedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for failed turns. Privacy-safe (no transcript or reply text) and throttled
 * per error kind to avoid log spam when a collaborator is down.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onTurnFinished(TurnFinishedEvent e) {
        if (e.state() != TurnState.FAILED) {
            return;
        }
        String kind = e.errorKind() == null ? "unknown" : e.errorKind().wireName();
        if (shouldLog("turn-failed-" + kind)) {
            LOG.warn("Turn failed: kind={}, turnId={}, sessionId={}, chunks={}. "
                    + "Check the {} collaborator.", kind, e.turnId(), e.sessionId(), e.totalChunks(),
                    collaboratorFor(kind));
        }
    }

    private static String collaboratorFor(String kind) {
        return switch (kind) {
            case "transcription_failed" -> "speech-to-text";
            case "generation_failed" -> "text generation";
            case "synthesis_failed" -> "text-to-speech";
            default -> "turn pipeline";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
