package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.AudioChunk;
import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.stream.PullStream;

/**
 * Speech synthesis collaborator.
 *
 * <p>Synthesizes one text span into a finite stream of audio chunks. A failure affects only
 * that span: the orchestrator logs it and moves on to the next span.
 */
public interface SpeechSynthesizer {

    /**
     * @param text  trimmed, non-blank span text
     * @param voice voice name, e.g. "de-DE-Chirp3-HD-Charon"
     * @param token turn cancellation
     * @return audio for the span, ending with end of stream or an error result
     * @throws com.phillippitts.talkback.exception.SynthesisException if the request cannot be started
     */
    PullStream<AudioChunk> synthesize(String text, String voice, CancellationToken token);

    String getName();

    boolean isAvailable();
}
