package com.vedant.dataquery.format;

import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Single sheet workbook. Only the header flag of the export options applies.
 */
public class XlsxFormatWriter implements FormatWriter {

    static final String SHEET_NAME = "Sheet1";

    @Override
    public FileFormat format() {
        return FileFormat.XLSX;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CreationHelper helper = workbook.getCreationHelper();
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd"));
            CellStyle timestampStyle = workbook.createCellStyle();
            timestampStyle.setDataFormat(helper.createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

            Sheet sheet = workbook.createSheet(SHEET_NAME);
            int r = 0;
            if (options.header()) {
                Row header = sheet.createRow(r++);
                List<String> names = table.columnNames();
                for (int c = 0; c < names.size(); c++) {
                    header.createCell(c).setCellValue(names.get(c));
                }
            }
            for (List<Object> values : table.rows()) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < values.size(); c++) {
                    Object v = values.get(c);
                    if (v == null) continue;
                    Cell cell = row.createCell(c);
                    if (v instanceof Number n) {
                        cell.setCellValue(n.doubleValue());
                    } else if (v instanceof Boolean b) {
                        cell.setCellValue(b);
                    } else if (v instanceof LocalDateTime ts) {
                        cell.setCellValue(ts);
                        cell.setCellStyle(timestampStyle);
                    } else if (v instanceof LocalDate d) {
                        cell.setCellValue(d);
                        cell.setCellStyle(dateStyle);
                    } else {
                        cell.setCellValue(ValueText.of(v));
                    }
                }
            }
            workbook.write(out);
        }
    }
}
