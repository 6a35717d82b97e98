package org.relaysync.engine;

import org.relaysync.client.ClientException;

/**
 * Why a run ended early.
 */
public enum RunError {
    REMOTE_UNAVAILABLE,
    AUTH_REJECTED,
    RECORD_NOT_FOUND,
    NO_TARGET_ADDRESS,
    INTERNAL;

    public static RunError of(ClientException e) {
        return e.getKind() == ClientException.FailureKind.UNAUTHORIZED ? AUTH_REJECTED : REMOTE_UNAVAILABLE;
    }
}
