package com.vedant.dataquery.model;

/**
 * Write configuration for text exports. Binary formats ignore it; xlsx only reads {@code header}.
 */
public record ExportOptions(boolean header, char delimiter, QuotingMode quoting, char quoteChar) {

    public ExportOptions {
        if (quoting == null) quoting = QuotingMode.MINIMAL;
        if (delimiter == quoteChar && quoting != QuotingMode.NONE) {
            throw new IllegalArgumentException("Delimiter and quote character must differ");
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(true, ',', QuotingMode.MINIMAL, '"');
    }
}
