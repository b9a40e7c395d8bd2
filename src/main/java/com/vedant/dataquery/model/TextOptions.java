package com.vedant.dataquery.model;

/**
 * Options for delimited text (csv, txt).
 *
 * @param headerPresent first non-blank line holds the column names
 * @param delimiter     one or more characters; the literal {@code \t} is expanded to a tab
 * @param quoting       how quotes are interpreted
 * @param quoteChar     quote character
 */
public record TextOptions(boolean headerPresent, String delimiter, QuotingMode quoting, char quoteChar)
        implements LoadOptions {

    public static final String DEFAULT_DELIMITER = ",";
    public static final char DEFAULT_QUOTE = '"';

    public TextOptions {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        delimiter = expandDelimiter(delimiter);
        if (quoting == null) quoting = QuotingMode.MINIMAL;
        if (delimiter.indexOf(quoteChar) >= 0 && quoting != QuotingMode.NONE) {
            throw new IllegalArgumentException("Delimiter and quote character must differ");
        }
    }

    public static TextOptions defaults() {
        return new TextOptions(true, DEFAULT_DELIMITER, QuotingMode.MINIMAL, DEFAULT_QUOTE);
    }

    public static String expandDelimiter(String delimiter) {
        return "\\t".equals(delimiter) ? "\t" : delimiter;
    }
}
