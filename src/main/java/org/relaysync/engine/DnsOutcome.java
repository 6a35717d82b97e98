package org.relaysync.engine;

public enum DnsOutcome {
    /** The run ended before the DNS step. */
    NOT_ATTEMPTED,
    /** No DNS token or domain on the job. */
    NOT_CONFIGURED,
    UNCHANGED,
    UPDATED,
    /** No zone or no A record for the domain. Records are never created. */
    RECORD_NOT_FOUND,
    FAILED
}
