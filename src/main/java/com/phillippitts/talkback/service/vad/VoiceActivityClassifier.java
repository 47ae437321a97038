package com.phillippitts.talkback.service.vad;

import com.phillippitts.talkback.domain.AudioFrame;

/**
 * Decides whether a single frame contains voice.
 *
 * <p>Implementations are shared by every session's detector, so they must be stateless or
 * thread-safe. They may throw; the detector treats a failed classification as silence.
 */
@FunctionalInterface
public interface VoiceActivityClassifier {

    boolean isVoiced(AudioFrame frame);
}
