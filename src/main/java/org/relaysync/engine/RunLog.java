package org.relaysync.engine;

import org.slf4j.Logger;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, timestamped log of one run. Lines read {@code [yyyy-MM-dd HH:mm:ss] message} in the
 * run's zone; once the cap is reached the oldest line is dropped for each new one.
 * Every line is also written to the given SLF4J logger.
 */
public class RunLog {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;
    private final Clock clock;
    private final int cap;
    private final Logger mirror;
    private final Deque<String> lines = new ArrayDeque<>();

    public RunLog(ZoneId zone, Clock clock, int cap, Logger mirror) {
        if (cap < 1) throw new IllegalArgumentException("cap must be positive");
        this.zone = zone;
        this.clock = clock;
        this.cap = cap;
        this.mirror = mirror;
    }

    public void add(String message) {
        String line = "[" + STAMP.format(ZonedDateTime.ofInstant(clock.instant(), zone)) + "] " + message;
        lines.addLast(line);
        while (lines.size() > cap) {
            lines.removeFirst();
        }
        if (mirror != null) {
            mirror.info(message);
        }
    }

    public List<String> lines() {
        return new ArrayList<>(lines);
    }

    public int size() {
        return lines.size();
    }
}
