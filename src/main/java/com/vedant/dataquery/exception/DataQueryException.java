package com.vedant.dataquery.exception;

/**
 * Base of every user facing failure. The message is the actionable summary shown to the user.
 */
public class DataQueryException extends RuntimeException {

    public DataQueryException(String message) {
        super(message);
    }

    public DataQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
