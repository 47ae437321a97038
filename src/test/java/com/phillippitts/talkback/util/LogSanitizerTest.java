package com.phillippitts.talkback.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hallo welt", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hallo welt", -1)).isEmpty();
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("hallo", 0)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hallo", 5)).isEqualTo("hallo");
        assertThat(LogSanitizer.truncate("hallo welt", 5)).isEqualTo("hallo");
    }

    @Test
    void shouldMarkCutInPreview() {
        assertThat(LogSanitizer.preview("Wie spät ist es?", 8)).isEqualTo("Wie spät...");
        assertThat(LogSanitizer.preview("kurz", 8)).isEqualTo("kurz");
    }

    @Test
    void shouldFlattenLineBreaksInPreview() {
        String forged = "Hallo\r\n2024-01-01 INFO fake entry";

        assertThat(LogSanitizer.preview(forged, 100))
                .doesNotContain("\n")
                .doesNotContain("\r")
                .isEqualTo("Hallo  2024-01-01 INFO fake entry");
    }
}
