package org.relaysync.store;

/**
 * The job store could not be read or written.
 */
public class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
