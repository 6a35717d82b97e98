package org.relaysync.engine;

public record ReloadSummary(int added, int removed, int rescheduled) {

    public static ReloadSummary none() {
        return new ReloadSummary(0, 0, 0);
    }

    public boolean changed() {
        return added + removed + rescheduled > 0;
    }
}
