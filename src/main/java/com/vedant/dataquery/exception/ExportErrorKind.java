package com.vedant.dataquery.exception;

public enum ExportErrorKind {
    /** Value needs quoting but the chosen quoting option forbids it. */
    QUOTING,
    /** The data cannot be written in the chosen format. */
    UNAVAILABLE,
    UNSUPPORTED_FORMAT,
    /** Nothing to export yet. */
    NO_RESULT
}
