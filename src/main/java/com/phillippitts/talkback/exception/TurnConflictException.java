package com.phillippitts.talkback.exception;

/**
 * A second turn was requested in a session whose turn gate is occupied.
 */
public class TurnConflictException extends TalkBackException {

    private final String activeTurnId;

    public TurnConflictException(String activeTurnId) {
        super(activeTurnId == null
                ? "A turn is already active"
                : "A turn is already active: " + activeTurnId);
        this.activeTurnId = activeTurnId;
    }

    /**
     * @return id of the occupying turn, or {@code null} if it was still being started
     */
    public String getActiveTurnId() {
        return activeTurnId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.TURN_CONFLICT;
    }
}
