package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Turn and conversation settings ({@code talkback.turn.*}).
 */
@Validated
@ConfigurationProperties(prefix = "talkback.turn")
public class TurnProperties {

    static final String DEFAULT_SYSTEM_PROMPT = "Du bist ein KI Agent, welcher Antworten auf Fragen "
            + "von den Nutzer geben kann. Antworte kurz, freundlich und in ganzen Sätzen, "
            + "denn deine Antwort wird vorgelesen.";

    @NotBlank
    private String defaultLanguage = "de-DE";

    @NotBlank
    private String defaultVoice = "de-DE-Chirp3-HD-Charon";

    /** Transcripts with fewer non-whitespace characters are rejected. */
    @Min(1)
    private int minTranscriptChars = 1;

    /** Completed exchanges kept per session for the prompt. */
    @Min(0)
    private int historySize = 10;

    @Min(0)
    private int contextMaxDocuments = 5;

    /** Retrieved context is only used for queries longer than this. */
    @Min(0)
    private int contextMinQueryChars = 10;

    @NotBlank
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    /** Segments queued while a turn is active; the oldest is dropped beyond this. */
    @Min(0)
    private int maxPendingSegments = 2;

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public String getDefaultVoice() {
        return defaultVoice;
    }

    public void setDefaultVoice(String defaultVoice) {
        this.defaultVoice = defaultVoice;
    }

    public int getMinTranscriptChars() {
        return minTranscriptChars;
    }

    public void setMinTranscriptChars(int minTranscriptChars) {
        this.minTranscriptChars = minTranscriptChars;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getContextMaxDocuments() {
        return contextMaxDocuments;
    }

    public void setContextMaxDocuments(int contextMaxDocuments) {
        this.contextMaxDocuments = contextMaxDocuments;
    }

    public int getContextMinQueryChars() {
        return contextMinQueryChars;
    }

    public void setContextMinQueryChars(int contextMinQueryChars) {
        this.contextMinQueryChars = contextMinQueryChars;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public int getMaxPendingSegments() {
        return maxPendingSegments;
    }

    public void setMaxPendingSegments(int maxPendingSegments) {
        this.maxPendingSegments = maxPendingSegments;
    }
}
