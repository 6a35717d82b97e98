package org.relaysync.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunLogTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T16:30:05Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("lines are stamped in the run's zone")
    void stampsInZone() {
        RunLog log = new RunLog(ZoneId.of("Asia/Shanghai"), CLOCK, 10, null);

        log.add("Logged in");

        assertThat(log.lines()).containsExactly("[2024-05-02 00:30:05] Logged in");
    }

    @Test
    @DisplayName("past the cap the oldest lines are dropped")
    void dropsOldest() {
        RunLog log = new RunLog(ZoneOffset.UTC, CLOCK, 3, null);

        for (int i = 1; i <= 5; i++) {
            log.add("line " + i);
        }

        List<String> lines = log.lines();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).endsWith("line 3");
        assertThat(lines.get(2)).endsWith("line 5");
    }

    @Test
    @DisplayName("a job-sized run stays within the default cap")
    void defaultCap() {
        RunLog log = new RunLog(ZoneOffset.UTC, CLOCK, JobExecutor.LOG_CAP, null);

        for (int i = 0; i < 250; i++) {
            log.add("rule " + i);
        }

        assertThat(log.size()).isEqualTo(200);
        assertThat(log.lines().get(199)).endsWith("rule 249");
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new RunLog(ZoneOffset.UTC, CLOCK, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("lines() is a snapshot")
    void snapshot() {
        RunLog log = new RunLog(ZoneOffset.UTC, CLOCK, 5, null);
        log.add("a");

        List<String> copy = log.lines();
        log.add("b");

        assertThat(copy).hasSize(1);
    }
}
