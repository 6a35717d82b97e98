package org.relaysync.engine;

/**
 * Per-job run slot. A run is handed to the worker pool only on the IDLE to QUEUED transition or
 * when a finishing run promotes its pending follow-up, so at most one run of a job exists at a time.
 */
public final class JobSlot {

    public enum State {
        IDLE,
        QUEUED,
        RUNNING,
        RUNNING_WITH_FOLLOW_UP
    }

    private State state = State.IDLE;

    synchronized TriggerOutcome request() {
        switch (state) {
            case IDLE:
                state = State.QUEUED;
                return TriggerOutcome.QUEUED;
            case RUNNING:
                state = State.RUNNING_WITH_FOLLOW_UP;
                return TriggerOutcome.FOLLOW_UP_QUEUED;
            default:
                return TriggerOutcome.COALESCED;
        }
    }

    synchronized void begin() {
        if (state != State.QUEUED) {
            throw new IllegalStateException("Run started from state " + state);
        }
        state = State.RUNNING;
    }

    /**
     * @return true when a follow-up was pending; the slot is then QUEUED again and the caller must submit it
     */
    synchronized boolean finish() {
        if (state == State.RUNNING_WITH_FOLLOW_UP) {
            state = State.QUEUED;
            return true;
        }
        state = State.IDLE;
        return false;
    }

    /** The pool refused the run. */
    synchronized void reset() {
        state = State.IDLE;
    }

    synchronized State state() {
        return state;
    }
}
