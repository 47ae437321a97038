package com.phillippitts.talkback.service.orchestration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class VoicePolicyTest {

    private final VoicePolicy policy = new VoicePolicy("de-DE-Chirp3-HD-Charon", "de-DE");

    @Test
    void keepsWellFormedVoice() {
        assertThat(policy.resolveVoice(" en-US-Neural2-F ")).isEqualTo("en-US-Neural2-F");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "alloy", "Charon", "de-DE"})
    void fallsBackToDefaultVoice(String requested) {
        assertThat(policy.resolveVoice(requested)).isEqualTo("de-DE-Chirp3-HD-Charon");
    }

    @Test
    void resolvesLanguage() {
        assertThat(policy.resolveLanguage(null)).isEqualTo("de-DE");
        assertThat(policy.resolveLanguage(" ")).isEqualTo("de-DE");
        assertThat(policy.resolveLanguage(" en-US ")).isEqualTo("en-US");
    }
}
