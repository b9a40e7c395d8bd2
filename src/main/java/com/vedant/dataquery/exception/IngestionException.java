package com.vedant.dataquery.exception;

/**
 * A unit (file, archive member or sheet) could not be loaded. Recoverable failures are the ones
 * the user can fix by changing load options.
 */
public class IngestionException extends DataQueryException {

    private final boolean recoverable;

    public IngestionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public IngestionException(String message, Throwable cause, boolean recoverable) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public IngestionException(String message) {
        this(message, null, false);
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
