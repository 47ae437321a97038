package com.phillippitts.talkback.exception;

import com.phillippitts.talkback.domain.SpeechSegment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link TranscriptionException} that records which segment and language
 * a transcriber adapter was working on when it failed.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Recognition request failed")
 *         .adapter("google-speech")
 *         .language(languageCode)
 *         .segment(segment)
 *         .cause(exception)
 *         .build();
 * </pre>
 *
 * The resulting message reads {@code Recognition request failed (language=de-DE, segmentMs=1500,
 * sampleRate=16000) (adapter: google-speech)}.
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private final Map<String, String> context = new LinkedHashMap<>();
    private String adapterName = "unknown";
    private Throwable cause;

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder adapter(String adapterName) {
        if (adapterName != null && !adapterName.isBlank()) {
            this.adapterName = adapterName;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder language(String languageCode) {
        return metadata("language", languageCode);
    }

    /**
     * Records the length and sample rate of the segment that failed to transcribe.
     */
    public TranscriptionExceptionBuilder segment(SpeechSegment segment) {
        if (segment != null) {
            metadata("segmentMs", segment.durationMs());
            metadata("sampleRate", segment.sampleRate());
        }
        return this;
    }

    /**
     * Adds a context entry; null keys or values are skipped.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            context.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detail = describe();
        return cause == null
                ? new TranscriptionException(detail, adapterName)
                : new TranscriptionException(detail, adapterName, cause);
    }

    private String describe() {
        if (context.isEmpty()) {
            return message;
        }
        StringJoiner joined = new StringJoiner(", ", message + " (", ")");
        context.forEach((key, value) -> joined.add(key + "=" + value));
        return joined.toString();
    }
}
