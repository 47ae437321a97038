package com.phillippitts.talkback.service.orchestration.event;

import com.phillippitts.talkback.domain.TurnState;
import com.phillippitts.talkback.exception.ErrorKind;

/**
 * Published once per turn, after the turn was removed from the process registry.
 *
 * @param turnId      turn identifier
 * @param sessionId   originating session (nullable)
 * @param state       terminal state
 * @param errorKind   error kind for FAILED and REJECTED turns, otherwise {@code null}
 * @param totalChunks audio chunks produced
 * @param durationMs  time from registration to cleanup
 */
public record TurnFinishedEvent(
        String turnId,
        String sessionId,
        TurnState state,
        ErrorKind errorKind,
        int totalChunks,
        long durationMs
) {}
