package org.relaysync.engine;

public enum NotifyOutcome {
    /** Nothing changed, so nothing to say. */
    NOT_REQUIRED,
    NOT_CONFIGURED,
    SENT,
    FAILED
}
