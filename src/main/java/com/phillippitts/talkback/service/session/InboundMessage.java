package com.phillippitts.talkback.service.session;

import java.util.Map;

/**
 * Decoded client message.
 */
public interface InboundMessage {

    /**
     * One block of microphone audio.
     *
     * @param samples     normalized samples
     * @param timestampMs client timestamp, or {@code null} to use the session's sample clock
     */
    record AudioFrameMessage(float[] samples, Long timestampMs) implements InboundMessage {
    }

    /**
     * The client stopped sending audio; whatever speech is buffered ends now.
     */
    record EndAudio() implements InboundMessage {
    }

    record TextPrompt(String text, String voice, String language) implements InboundMessage {
    }

    /**
     * Explicit audio turn with a complete recording.
     */
    record StartTurn(float[] samples, String language, String voice, Map<String, String> metadata)
            implements InboundMessage {
    }

    record StopTurn(String id, String reason) implements InboundMessage {
    }

    record StopAll(String reason) implements InboundMessage {
    }
}
