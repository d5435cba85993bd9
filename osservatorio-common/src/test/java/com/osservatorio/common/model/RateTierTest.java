package com.osservatorio.common.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateTierTest {

    private static long millis(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    @Test
    void windowsAreAlignedToTheEpoch() {
        long now = millis("2024-05-01T08:17:42.500Z");

        assertThat(RateTier.BURST.windowStartMillis(now)).isEqualTo(millis("2024-05-01T08:17:42Z"));
        assertThat(RateTier.MINUTE.windowStartMillis(now)).isEqualTo(millis("2024-05-01T08:17:00Z"));
        assertThat(RateTier.HOUR.windowStartMillis(now)).isEqualTo(millis("2024-05-01T08:00:00Z"));
        assertThat(RateTier.DAY.windowStartMillis(now)).isEqualTo(millis("2024-05-01T00:00:00Z"));
        assertThat(RateTier.MINUTE.windowEndMillis(now)).isEqualTo(millis("2024-05-01T08:18:00Z"));
    }

    @Test
    void boundaryInstantStartsANewWindow() {
        long boundary = millis("2024-05-01T08:18:00Z");

        assertThat(RateTier.MINUTE.windowStartMillis(boundary)).isEqualTo(boundary);
        assertThat(RateTier.MINUTE.windowStartMillis(boundary - 1)).isEqualTo(millis("2024-05-01T08:17:00Z"));
    }
}
