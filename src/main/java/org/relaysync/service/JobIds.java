package org.relaysync.service;

import java.time.Clock;

/**
 * Job ids are epoch millis, bumped past the last one handed out so two creations in the same
 * millisecond still get distinct ids.
 */
public class JobIds {

    private final Clock clock;
    private long last;

    public JobIds(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        last = Math.max(clock.millis(), last + 1);
        return Long.toString(last);
    }
}
