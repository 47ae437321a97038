package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.domain.Transcript;
import com.phillippitts.talkback.exception.TranscriptionException;

/**
 * Speech-to-text collaborator.
 *
 * <p>Implementations wrap a concrete speech service behind this interface and are shared by
 * every session, so they must be thread-safe. Calls may block; the orchestrator runs them on
 * a dedicated executor and abandons them when the turn is cancelled (the calling thread is
 * interrupted).
 *
 * @see TranscriptionException
 */
public interface Transcriber {

    /**
     * Transcribes one speech segment.
     *
     * @param segment      audio to transcribe
     * @param languageCode BCP-47 language, e.g. "de-DE"
     * @return transcript, possibly with empty text
     * @throws TranscriptionException on transport or service errors
     */
    Transcript transcribe(SpeechSegment segment, String languageCode);

    /**
     * Name for logging and health reporting.
     */
    String getName();

    /**
     * Whether the collaborator is configured and currently usable.
     */
    boolean isAvailable();
}
