package org.relaysync.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ZoneUtilTest {

    private static final ZoneId FALLBACK = ZoneId.of("Asia/Shanghai");

    @ParameterizedTest
    @ValueSource(strings = {"UTC", "Europe/Berlin", " Asia/Tokyo "})
    @DisplayName("known zone ids are valid and resolve to themselves")
    void valid(String zone) {
        assertThat(ZoneUtil.isValid(zone)).isTrue();
        assertThat(ZoneUtil.resolve(zone, FALLBACK)).isEqualTo(ZoneId.of(zone.trim()));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Mars/Olympus", "   "})
    @DisplayName("missing or unknown zone ids fall back")
    void invalid(String zone) {
        assertThat(ZoneUtil.isValid(zone)).isFalse();
        assertThat(ZoneUtil.resolve(zone, FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    @DisplayName("fixed offsets are accepted")
    void offsets() {
        assertThat(ZoneUtil.resolve("+08:00", FALLBACK)).isEqualTo(ZoneId.of("+08:00"));
    }
}
