package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session transport settings ({@code talkback.websocket.*}).
 */
@Validated
@ConfigurationProperties(prefix = "talkback.websocket")
public class WebSocketProperties {

    @NotBlank
    private String path = "/ws/voice";

    private String[] allowedOrigins = {"*"};

    /** Per-session outbound buffer before a slow client is disconnected. */
    private int sendBufferSizeBytes = 512 * 1024;

    private int sendTimeLimitMs = 10_000;

    /** Largest inbound text message accepted (audio frames arrive as JSON arrays). */
    private int maxTextMessageBytes = 1024 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String[] getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getSendBufferSizeBytes() {
        return sendBufferSizeBytes;
    }

    public void setSendBufferSizeBytes(int sendBufferSizeBytes) {
        this.sendBufferSizeBytes = sendBufferSizeBytes;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getMaxTextMessageBytes() {
        return maxTextMessageBytes;
    }

    public void setMaxTextMessageBytes(int maxTextMessageBytes) {
        this.maxTextMessageBytes = maxTextMessageBytes;
    }
}
