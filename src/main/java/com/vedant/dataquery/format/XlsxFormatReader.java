package com.vedant.dataquery.format;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.SpreadsheetOptions;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Spreadsheets with Apache POI. Every sheet becomes its own table, read with its own header flag.
 */
public class XlsxFormatReader implements FormatReader {

    @Override
    public FileFormat format() {
        return FileFormat.XLSX;
    }

    /** Sheet names in workbook order, needed before options can be collected. */
    public static List<String> sheetNames(byte[] content) {
        try (Workbook workbook = open(content)) {
            List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw new IngestionException("Could not open workbook: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        SpreadsheetOptions opts = options instanceof SpreadsheetOptions s ? s : SpreadsheetOptions.allWithHeader();
        try (Workbook workbook = open(content)) {
            List<ReadResult> results = new ArrayList<>(workbook.getNumberOfSheets());
            for (Sheet sheet : workbook) {
                String name = sheet.getSheetName();
                results.add(new ReadResult(name, readSheet(sheet, opts.headerPresent(name))));
            }
            return results;
        } catch (IOException e) {
            throw new IngestionException("Could not read workbook: " + e.getMessage(), e);
        }
    }

    private static Workbook open(byte[] content) throws IOException {
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(content));
        } catch (RuntimeException e) {
            // POI signals corrupt or non-OOXML content with assorted unchecked exceptions
            throw new IOException(e.getMessage(), e);
        }
    }

    private DataTable readSheet(Sheet sheet, boolean headerPresent) {
        List<List<Object>> records = new ArrayList<>();
        int width = 0;
        for (Row row : sheet) {
            List<Object> values = new ArrayList<>();
            boolean any = false;
            for (int c = 0; c < row.getLastCellNum(); c++) {
                Object v = cellValue(row.getCell(c));
                values.add(v);
                if (v != null) any = true;
            }
            if (!any) continue;
            width = Math.max(width, values.size());
            records.add(values);
        }

        List<String> rawNames = new ArrayList<>(width);
        if (headerPresent && !records.isEmpty()) {
            List<Object> header = records.remove(0);
            for (int c = 0; c < width; c++) {
                rawNames.add(c < header.size() && header.get(c) != null ? asText(header.get(c)) : null);
            }
        }
        List<String> names = headerPresent ? DataTable.uniqueNames(rawNames) : DataTable.positionalNames(width);

        List<Column> columns = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            columns.add(new Column(names.get(c), columnType(records, c)));
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (List<Object> r : records) {
            List<Object> row = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Object v = c < r.size() ? r.get(c) : null;
                row.add(columns.get(c).type() == ColumnType.VARCHAR && v != null ? asText(v) : v);
            }
            rows.add(row);
        }
        return DataTable.of(columns, rows);
    }

    private static ColumnType columnType(List<List<Object>> records, int c) {
        boolean any = false;
        boolean allBool = true;
        boolean allInt = true;
        boolean allNumber = true;
        boolean allDate = true;
        for (List<Object> r : records) {
            Object v = c < r.size() ? r.get(c) : null;
            if (v == null) continue;
            any = true;
            if (!(v instanceof Boolean)) allBool = false;
            if (!(v instanceof Double d)) {
                allNumber = false;
                allInt = false;
            } else if (d != Math.rint(d) || Math.abs(d) > 9.0e15) {
                allInt = false;
            }
            if (!(v instanceof LocalDateTime)) allDate = false;
        }
        if (!any) return ColumnType.VARCHAR;
        if (allBool) return ColumnType.BOOLEAN;
        if (allInt) return ColumnType.BIGINT;
        if (allNumber) return ColumnType.DOUBLE;
        if (allDate) return ColumnType.TIMESTAMP;
        return ColumnType.VARCHAR;
    }

    private static Object cellValue(Cell c) {
        if (c == null) return null;
        CellType type = c.getCellType() == CellType.FORMULA ? c.getCachedFormulaResultType() : c.getCellType();
        return switch (type) {
            case STRING -> {
                String s = c.getStringCellValue();
                yield s == null || s.isEmpty() ? null : s;
            }
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(c)) yield c.getLocalDateTimeCellValue();
                else yield c.getNumericCellValue();
            }
            case BOOLEAN -> c.getBooleanCellValue();
            default -> null;
        };
    }

    private static String asText(Object v) {
        if (v instanceof Double d) {
            if (d == Math.rint(d) && !Double.isInfinite(d)) return BigDecimal.valueOf(d).toBigInteger().toString();
            return Double.toString(d);
        }
        return v.toString();
    }
}
