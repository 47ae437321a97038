package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.exception.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message sent to a session client.
 *
 * <p>Turn messages carry the turn id; connection-level control messages
 * ({@code turn_stopped}, {@code all_turns_stopped}) and turn requests rejected before a turn
 * existed carry {@code null}.
 *
 * @param type    wire type
 * @param turnId  owning turn, or {@code null}
 * @param payload remaining fields in insertion order
 */
public record OutboundMessage(String type, String turnId, Map<String, Object> payload) {

    public static final String TURN_STARTED = "turn_started";
    public static final String TRANSCRIPTION = "transcription";
    public static final String AUDIO_CHUNK = "audio_chunk";
    public static final String TURN_END = "turn_end";
    public static final String TURN_ERROR = "turn_error";
    public static final String TURN_CANCELLED = "turn_cancelled";
    public static final String TURN_STOPPED = "turn_stopped";
    public static final String ALL_TURNS_STOPPED = "all_turns_stopped";

    public OutboundMessage {
        Objects.requireNonNull(type, "type must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static OutboundMessage turnStarted(String turnId, String input) {
        return new OutboundMessage(TURN_STARTED, turnId, Map.of("input", input));
    }

    public static OutboundMessage transcription(String turnId, String text, double confidence, String languageCode) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("confidence", confidence);
        payload.put("language_code", languageCode);
        return new OutboundMessage(TRANSCRIPTION, turnId, payload);
    }

    /**
     * @param text span text on the first chunk of a span, otherwise {@code null}
     */
    public static OutboundMessage audioChunk(String turnId, int chunkNumber, int sampleRate, short[] samples,
                                             String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chunk_number", chunkNumber);
        payload.put("sample_rate", sampleRate);
        payload.put("samples", samples);
        if (text != null) {
            payload.put("text", text);
        }
        return new OutboundMessage(AUDIO_CHUNK, turnId, payload);
    }

    public static OutboundMessage turnEnd(String turnId, int totalChunks) {
        return new OutboundMessage(TURN_END, turnId, Map.of("total_chunks", totalChunks));
    }

    public static OutboundMessage turnError(String turnId, ErrorKind kind, String detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", detail == null ? kind.wireName() : detail);
        payload.put("kind", kind.wireName());
        return new OutboundMessage(TURN_ERROR, turnId, payload);
    }

    public static OutboundMessage turnCancelled(String turnId, String reason) {
        return new OutboundMessage(TURN_CANCELLED, turnId, Map.of("reason", reason));
    }

    public static OutboundMessage turnStopped(String id, boolean stopped) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("stopped", stopped);
        return new OutboundMessage(TURN_STOPPED, null, payload);
    }

    public static OutboundMessage allTurnsStopped(int stoppedCount) {
        return new OutboundMessage(ALL_TURNS_STOPPED, null, Map.of("stopped_count", stoppedCount));
    }
}
