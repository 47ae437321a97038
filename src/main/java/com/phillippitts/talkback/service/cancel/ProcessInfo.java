package com.phillippitts.talkback.service.cancel;

import com.phillippitts.talkback.domain.TurnMetadata;

import java.time.Instant;
import java.util.Objects;

/**
 * Registry entry for one running turn.
 *
 * @param id        opaque turn identifier
 * @param name      descriptive process name, e.g. "audio_turn" or "text_turn"
 * @param startedAt registration time
 * @param token     cancellation handle for the turn
 * @param metadata  language, voice and originating session
 */
public record ProcessInfo(String id, String name, Instant startedAt, CancellationToken token, TurnMetadata metadata) {

    public ProcessInfo {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }
}
