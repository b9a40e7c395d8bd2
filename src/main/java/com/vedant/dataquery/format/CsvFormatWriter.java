package com.vedant.dataquery.format;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.vedant.dataquery.exception.ExportErrorKind;
import com.vedant.dataquery.exception.ExportException;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.QuotingMode;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Delimited text with OpenCSV's writer. NONNUMERIC quoting is applied per value, the other modes
 * are handled by the writer itself.
 */
public class CsvFormatWriter implements FormatWriter {

    static final String QUOTING_MESSAGE =
            "Special character found in the data. Please select a different quoting option.";

    private final FileFormat format;

    public CsvFormatWriter(FileFormat format) {
        if (format != FileFormat.CSV && format != FileFormat.TXT) {
            throw new IllegalArgumentException("Not a delimited text format: " + format);
        }
        this.format = format;
    }

    @Override
    public FileFormat format() {
        return format;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        QuotingMode quoting = options.quoting();
        boolean writerQuotes = quoting == QuotingMode.ALL || quoting == QuotingMode.MINIMAL;
        char quote = writerQuotes ? options.quoteChar() : ICSVWriter.NO_QUOTE_CHARACTER;
        char escape = writerQuotes ? options.quoteChar() : ICSVWriter.NO_ESCAPE_CHARACTER;

        CSVWriter csv = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8),
                options.delimiter(), quote, escape, "\n");
        try {
            boolean quoteAll = quoting == QuotingMode.ALL;
            if (options.header()) {
                List<String> names = table.columnNames();
                String[] header = new String[names.size()];
                for (int c = 0; c < header.length; c++) {
                    header[c] = field(names.get(c), false, options);
                }
                csv.writeNext(header, quoteAll);
            }
            String[] line = new String[table.columnCount()];
            for (List<Object> row : table.rows()) {
                for (int c = 0; c < line.length; c++) {
                    Object v = row.get(c);
                    line[c] = v == null ? "" : field(ValueText.of(v), v instanceof Number, options);
                }
                csv.writeNext(line, quoteAll);
            }
            csv.flush();
            if (csv.checkError()) {
                throw new IOException("CSV writer reported an error");
            }
        } finally {
            csv.close();
        }
    }

    private static String field(String text, boolean numeric, ExportOptions options) {
        switch (options.quoting()) {
            case NONE -> {
                if (needsEscape(text, options)) {
                    throw new ExportException(ExportErrorKind.QUOTING, QUOTING_MESSAGE);
                }
                return text;
            }
            case NONNUMERIC -> {
                if (numeric) {
                    if (needsEscape(text, options)) {
                        throw new ExportException(ExportErrorKind.QUOTING, QUOTING_MESSAGE);
                    }
                    return text;
                }
                String q = String.valueOf(options.quoteChar());
                return q + text.replace(q, q + q) + q;
            }
            default -> {
                return text;
            }
        }
    }

    private static boolean needsEscape(String text, ExportOptions options) {
        return text.indexOf(options.delimiter()) >= 0
                || text.indexOf(options.quoteChar()) >= 0
                || text.indexOf('\n') >= 0
                || text.indexOf('\r') >= 0;
    }
}
