package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.TurnState;
import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.service.stream.PullStream;

/**
 * A registered, lazily executed turn.
 *
 * <p>Each {@link #next()} advances the turn as far as needed to produce the next event. The turn
 * ends with END_OF_STREAM (completed), CANCELLED, or ERROR (failed or rejected), and is removed
 * from the process registry exactly once at that point. {@link #close()} before the end cancels
 * the turn.
 */
public interface TurnStream extends PullStream<TurnEvent> {

    String getTurnId();

    TurnState getState();

    /**
     * Error kind of a failed or rejected turn, otherwise {@code null}.
     */
    ErrorKind getErrorKind();

    /**
     * Audio chunks produced so far.
     */
    int getTotalChunks();

    /**
     * Requests cancellation; equivalent to stopping the turn through the registry.
     *
     * @return {@code true} if this call cancelled the turn
     */
    boolean cancel(String reason);
}
