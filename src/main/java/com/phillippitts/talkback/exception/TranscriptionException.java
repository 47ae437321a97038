package com.phillippitts.talkback.exception;

/**
 * Thrown when a speech-to-text call fails.
 * This may occur due to transport errors, timeouts, or an unusable adapter response.
 */
public class TranscriptionException extends TalkBackException {

    private final String adapterName;

    public TranscriptionException(String message) {
        super(message);
        this.adapterName = "unknown";
    }

    public TranscriptionException(String message, String adapterName) {
        super(message + " (adapter: " + adapterName + ")");
        this.adapterName = adapterName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.adapterName = "unknown";
    }

    public TranscriptionException(String message, String adapterName, Throwable cause) {
        super(message + " (adapter: " + adapterName + ")", cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.TRANSCRIPTION;
    }
}
