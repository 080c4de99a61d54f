package com.phillippitts.streamscribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 5)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void maskSecretKeepsNoCharacterOfTheSecret() {
        assertThat(LogSanitizer.maskSecret(null)).isEmpty();
        assertThat(LogSanitizer.maskSecret("")).isEmpty();
        assertThat(LogSanitizer.maskSecret("short-token")).isEqualTo("****");
        assertThat(LogSanitizer.maskSecret("Bearer 0123456789abcdefXYZW")).isEqualTo("****");
    }
}
