package com.phillippitts.talkback.exception;

/**
 * Thrown when the text generator cannot start or continue a response stream.
 */
public class GenerationException extends TalkBackException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.GENERATION;
    }
}
