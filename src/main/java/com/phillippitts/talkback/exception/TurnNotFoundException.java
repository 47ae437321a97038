package com.phillippitts.talkback.exception;

/**
 * Thrown at the REST boundary when a stop request names a turn that is not registered.
 * Inside the core an unknown id is a normal outcome ({@code false}), never an exception.
 */
public class TurnNotFoundException extends TalkBackException {

    private final String turnId;

    public TurnNotFoundException(String turnId) {
        super("Turn not found: " + turnId);
        this.turnId = turnId;
    }

    public String getTurnId() {
        return turnId;
    }
}
