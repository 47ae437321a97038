package com.phillippitts.talkback.exception;

/**
 * Thrown when turn input is rejected before any external call is made
 * (empty prompt text, empty audio, blank transcript).
 * This is a business-rule rejection, not a system fault.
 */
public class InvalidTurnInputException extends TalkBackException {

    private final String field;
    private final String reason;

    public InvalidTurnInputException(String field, String reason) {
        super("Invalid turn input (" + field + "): " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.VALIDATION;
    }
}
