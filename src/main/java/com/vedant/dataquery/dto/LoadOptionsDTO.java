package com.vedant.dataquery.dto;

import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.QuotingMode;
import com.vedant.dataquery.model.SpreadsheetOptions;
import com.vedant.dataquery.model.TextOptions;

import java.util.Map;

/**
 * Options the client sends for one unit. Text files use header, delimiter, quoting and quoteChar;
 * spreadsheets use the per sheet header flags.
 */
public class LoadOptionsDTO {
    private Boolean header;
    private String delimiter;
    private String quoting;
    private String quoteChar;
    private Map<String, Boolean> sheets;

    public LoadOptions toLoadOptions(FileFormat format) {
        switch (format) {
            case CSV:
            case TXT:
                String quote = quoteChar == null || quoteChar.isEmpty() ? String.valueOf(TextOptions.DEFAULT_QUOTE) : quoteChar;
                if (quote.length() != 1) {
                    throw new IllegalArgumentException("Quote character must be a single character");
                }
                return new TextOptions(
                        header == null || header,
                        delimiter == null ? TextOptions.DEFAULT_DELIMITER : delimiter,
                        QuotingMode.parse(quoting),
                        quote.charAt(0));
            case XLSX:
                return new SpreadsheetOptions(sheets);
            default:
                return LoadOptions.defaultsFor(format);
        }
    }

    public Boolean getHeader() { return header; }
    public void setHeader(Boolean header) { this.header = header; }

    public String getDelimiter() { return delimiter; }
    public void setDelimiter(String delimiter) { this.delimiter = delimiter; }

    public String getQuoting() { return quoting; }
    public void setQuoting(String quoting) { this.quoting = quoting; }

    public String getQuoteChar() { return quoteChar; }
    public void setQuoteChar(String quoteChar) { this.quoteChar = quoteChar; }

    public Map<String, Boolean> getSheets() { return sheets; }
    public void setSheets(Map<String, Boolean> sheets) { this.sheets = sheets; }
}
