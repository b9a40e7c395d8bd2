package com.vedant.dataquery.format;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.exception.MalformedRowException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.QuotingMode;
import com.vedant.dataquery.model.TextOptions;
import com.vedant.dataquery.util.TypeInference;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Delimited text (csv and txt) with OpenCSV. Column types are inferred from the values.
 */
public class CsvFormatReader implements FormatReader {

    // stands in for delimiters longer than one character
    private static final char UNIT_SEPARATOR = '\u001F';

    private final FileFormat format;

    public CsvFormatReader(FileFormat format) {
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
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        TextOptions opts = options instanceof TextOptions t ? t : TextOptions.defaults();
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) text = text.substring(1);

        char separator;
        if (opts.delimiter().length() == 1) {
            separator = opts.delimiter().charAt(0);
        } else {
            separator = UNIT_SEPARATOR;
            text = text.replace(opts.delimiter(), String.valueOf(UNIT_SEPARATOR));
        }

        List<String[]> records = tokenize(text, separator, opts);
        if (records.isEmpty()) {
            throw new IngestionException("No columns to parse from file");
        }

        String[] header = opts.headerPresent() ? records.remove(0) : null;
        int width = header != null ? header.length : records.get(0).length;
        List<String> names = header != null
                ? DataTable.uniqueNames(Arrays.asList(header))
                : DataTable.positionalNames(width);

        List<Column> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            List<String> samples = new ArrayList<>(records.size());
            for (String[] r : records) samples.add(c < r.length ? r[c] : null);
            ColumnType type = TypeInference.infer(samples);
            if (opts.quoting() == QuotingMode.NONNUMERIC && type == ColumnType.BIGINT) {
                type = ColumnType.DOUBLE;
            }
            columns.add(new Column(names.get(c), type));
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (String[] r : records) {
            List<Object> row = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                row.add(TypeInference.cell(c < r.length ? r[c] : null, columns.get(c).type()));
            }
            rows.add(row);
        }

        try {
            return List.of(ReadResult.single(DataTable.of(columns, rows)));
        } catch (IllegalArgumentException ex) {
            throw new IngestionException(ex.getMessage(), ex);
        }
    }

    private List<String[]> tokenize(String text, char separator, TextOptions opts) {
        boolean ignoreQuotes = opts.quoting() == QuotingMode.NONE;
        CSVParser parser = new CSVParserBuilder()
                .withSeparator(separator)
                .withQuoteChar(ignoreQuotes ? ICSVParser.NULL_CHARACTER : opts.quoteChar())
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .withIgnoreQuotations(ignoreQuotes)
                .build();

        List<String[]> records = new ArrayList<>();
        int expected = -1;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text)).withCSVParser(parser).build()) {
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (isBlankLine(line)) continue;
                if (expected < 0) {
                    expected = line.length;
                } else if (line.length > expected) {
                    throw new MalformedRowException(reader.getLinesRead(), expected, line.length);
                }
                records.add(line);
            }
        } catch (IOException | CsvValidationException e) {
            throw new IngestionException("Error tokenizing data. " + e.getMessage(), e, true);
        }
        return records;
    }

    private static boolean isBlankLine(String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].isBlank());
    }
}
