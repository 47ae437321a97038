package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.SpeechSegment;
import com.phillippitts.talkback.domain.TurnMetadata;

import java.util.Objects;

/**
 * Input for one turn: either recorded speech or typed text, never both.
 *
 * @param segment  speech to transcribe (audio turns)
 * @param text     user text (text turns)
 * @param metadata session, language and voice
 * @param history  session history read for the prompt and appended on completion
 */
public record TurnRequest(SpeechSegment segment, String text, TurnMetadata metadata, ConversationHistory history) {

    public TurnRequest {
        if ((segment == null) == (text == null)) {
            throw new IllegalArgumentException("Exactly one of segment or text must be given");
        }
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(history, "history must not be null");
    }

    public static TurnRequest audio(SpeechSegment segment, TurnMetadata metadata, ConversationHistory history) {
        return new TurnRequest(segment, null, metadata, history);
    }

    public static TurnRequest text(String text, TurnMetadata metadata, ConversationHistory history) {
        return new TurnRequest(null, text, metadata, history);
    }

    public boolean isAudio() {
        return segment != null;
    }

    /**
     * Registry process name.
     */
    public String processName() {
        return isAudio() ? "audio_turn" : "text_turn";
    }
}
