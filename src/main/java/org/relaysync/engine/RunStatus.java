package org.relaysync.engine;

public enum RunStatus {
    SUCCESS,
    FAILED,
    /** The job was gone by the time the run started; nothing was written. */
    SKIPPED
}
