package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the streaming synthesis chunker ({@code talkback.chunker.*}).
 */
@Validated
@ConfigurationProperties(prefix = "talkback.chunker")
public class ChunkerProperties {

    /**
     * Buffer length above which the chunker falls back to cutting at a word boundary.
     */
    @Min(10)
    private final int maxChars;

    @ConstructorBinding
    public ChunkerProperties(Integer maxChars) {
        this.maxChars = maxChars == null ? 80 : maxChars;
    }

    public int getMaxChars() {
        return maxChars;
    }
}
