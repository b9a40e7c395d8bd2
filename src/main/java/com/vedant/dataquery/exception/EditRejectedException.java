package com.vedant.dataquery.exception;

/**
 * Edited rows that change the shape of the result (column names or types) or hold bad values.
 */
public class EditRejectedException extends DataQueryException {

    public EditRejectedException(String message) {
        super(message);
    }

    public EditRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
