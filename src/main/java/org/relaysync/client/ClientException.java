package org.relaysync.client;

/**
 * A remote call failed. The {@link FailureKind} says how; the message is meant for the run log.
 */
public class ClientException extends Exception {

    public enum FailureKind {
        TIMEOUT,
        UNAUTHORIZED,
        NOT_FOUND,
        MALFORMED,
        UNREACHABLE
    }

    private final FailureKind kind;
    private final int httpStatus;

    public ClientException(FailureKind kind, String message) {
        this(kind, message, -1, null);
    }

    public ClientException(FailureKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public ClientException(FailureKind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * @return the HTTP status of the failed reply, or -1 when no reply was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
