package com.vedant.dataquery.exception;

public enum QueryErrorKind {
    EMPTY("Please enter a SQL query."),
    UNKNOWN_TABLE("Table not existing. Please check table names in your query."),
    ILLEGAL_MUTATION("Update not available. Please consider a different select statement and the edit mode."),
    OTHER("Error executing query");

    private final String summary;

    QueryErrorKind(String summary) {
        this.summary = summary;
    }

    public String summary() {
        return summary;
    }
}
