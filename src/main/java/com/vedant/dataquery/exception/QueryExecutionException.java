package com.vedant.dataquery.exception;

public class QueryExecutionException extends DataQueryException {

    private final QueryErrorKind kind;

    public QueryExecutionException(QueryErrorKind kind, String detail, Throwable cause) {
        super(message(kind, detail), cause);
        this.kind = kind;
    }

    public QueryExecutionException(QueryErrorKind kind) {
        this(kind, null, null);
    }

    public QueryErrorKind getKind() {
        return kind;
    }

    private static String message(QueryErrorKind kind, String detail) {
        if (kind == QueryErrorKind.OTHER) {
            return kind.summary() + ": " + (detail == null ? "unknown error" : detail);
        }
        return kind.summary();
    }
}
