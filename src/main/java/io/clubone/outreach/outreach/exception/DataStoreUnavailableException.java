package io.clubone.outreach.outreach.exception;

/**
 * The data store could not be reached at all. Aborts the whole run.
 */
public class DataStoreUnavailableException extends RuntimeException {

    public DataStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
