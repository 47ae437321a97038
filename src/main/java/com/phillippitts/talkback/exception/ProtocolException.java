package com.phillippitts.talkback.exception;

/**
 * Thrown when an inbound session message cannot be decoded.
 * The offending message is logged and dropped; the session stays open.
 */
public class ProtocolException extends TalkBackException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PROTOCOL;
    }
}
