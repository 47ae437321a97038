package com.phillippitts.talkback.exception;

/**
 * Thrown when speech synthesis of a single text span fails.
 * The orchestrator isolates these per span; they never abort a whole turn.
 */
public class SynthesisException extends TalkBackException {

    private final String span;

    public SynthesisException(String message, String span) {
        super(message);
        this.span = span;
    }

    public SynthesisException(String message, String span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public String getSpan() {
        return span;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.SYNTHESIS;
    }
}
