package com.phillippitts.talkback.service.orchestration;

/**
 * Resolves the voice and language for a turn from client preferences and configured defaults.
 */
public final class VoicePolicy {

    private static final int MIN_VOICE_NAME_LENGTH = 6;

    private final String defaultVoice;
    private final String defaultLanguage;

    public VoicePolicy(String defaultVoice, String defaultLanguage) {
        this.defaultVoice = defaultVoice;
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * Voice names look like {@code de-DE-Chirp3-HD-Charon}; anything blank, without a dash
     * or shorter than six characters falls back to the default voice.
     */
    public String resolveVoice(String requested) {
        if (requested == null) {
            return defaultVoice;
        }
        String voice = requested.strip();
        if (voice.length() < MIN_VOICE_NAME_LENGTH || voice.indexOf('-') < 0) {
            return defaultVoice;
        }
        return voice;
    }

    public String resolveLanguage(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultLanguage;
        }
        return requested.strip();
    }

    public String getDefaultVoice() {
        return defaultVoice;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }
}
