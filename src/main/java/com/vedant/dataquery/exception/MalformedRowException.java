package com.vedant.dataquery.exception;

/**
 * Delimited text whose rows do not tokenize into the expected number of fields.
 */
public class MalformedRowException extends IngestionException {

    private final long lineNumber;

    public MalformedRowException(long lineNumber, int expected, int actual) {
        super(String.format("Error tokenizing data. Expected %d fields in line %d, saw %d",
                expected, lineNumber, actual), null, true);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
