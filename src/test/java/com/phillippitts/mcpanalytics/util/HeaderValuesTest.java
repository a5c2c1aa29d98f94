package com.phillippitts.mcpanalytics.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderValuesTest {

    @Test
    void orDefaultReplacesNullAndBlank() {
        assertThat(HeaderValues.orDefault(null, "unknown")).isEqualTo("unknown");
        assertThat(HeaderValues.orDefault(" \t", "unknown")).isEqualTo("unknown");
        assertThat(HeaderValues.orDefault("node", "unknown")).isEqualTo("node");
    }

    @Test
    void truncateLimitsLength() {
        assertThat(HeaderValues.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(HeaderValues.truncate("abc", 3)).isEqualTo("abc");
        assertThat(HeaderValues.truncate(null, 3)).isEmpty();
        assertThat(HeaderValues.truncate("abc", 0)).isEmpty();
    }
}
