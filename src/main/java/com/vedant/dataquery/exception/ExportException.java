package com.vedant.dataquery.exception;

public class ExportException extends DataQueryException {

    private final ExportErrorKind kind;

    public ExportException(ExportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ExportException(ExportErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ExportErrorKind getKind() {
        return kind;
    }
}
