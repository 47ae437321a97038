package com.phillippitts.talkback.domain;

/**
 * Lifecycle of one turn.
 *
 * <pre>
 * CREATED → TRANSCRIBING → GENERATING → SYNTHESIZING → COMPLETED
 *                    (any non-terminal) → CANCELLED | FAILED | REJECTED
 * </pre>
 *
 * <p>{@code SYNTHESIZING} and {@code GENERATING} alternate while spans are produced.
 */
public enum TurnState {
    CREATED,
    TRANSCRIBING,
    GENERATING,
    SYNTHESIZING,
    COMPLETED,
    CANCELLED,
    FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED || this == REJECTED;
    }
}
