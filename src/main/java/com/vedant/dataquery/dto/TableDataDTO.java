package com.vedant.dataquery.dto;

import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.DataTable;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A result table as shown to the user. Rows carry a 1-based {@code index}; dates are ISO text
 * and binary values base64.
 */
public class TableDataDTO {
    private List<Map<String, String>> columns;
    private List<List<Object>> rows;
    private List<Integer> index;
    private Integer rowCount;
    private String message;

    public static TableDataDTO from(DataTable table) {
        TableDataDTO dto = new TableDataDTO();
        List<Map<String, String>> cols = new ArrayList<>(table.columnCount());
        for (Column c : table.columns()) {
            Map<String, String> col = new LinkedHashMap<>();
            col.put("name", c.name());
            col.put("type", c.type().name());
            cols.add(col);
        }
        List<List<Object>> rows = new ArrayList<>(table.rowCount());
        List<Integer> index = new ArrayList<>(table.rowCount());
        int i = 1;
        for (List<Object> row : table.rows()) {
            List<Object> out = new ArrayList<>(row.size());
            for (Object v : row) out.add(display(v));
            rows.add(out);
            index.add(i++);
        }
        dto.setColumns(cols);
        dto.setRows(rows);
        dto.setIndex(index);
        dto.setRowCount(table.rowCount());
        return dto;
    }

    public static TableDataDTO message(String message) {
        TableDataDTO dto = new TableDataDTO();
        dto.setMessage(message);
        return dto;
    }

    private static Object display(Object v) {
        if (v instanceof Temporal) return v.toString();
        if (v instanceof byte[] b) return Base64.getEncoder().encodeToString(b);
        if (v instanceof Double d && (d.isNaN() || d.isInfinite())) return d.toString();
        return v;
    }

    public List<Map<String, String>> getColumns() { return columns; }
    public void setColumns(List<Map<String, String>> columns) { this.columns = columns; }

    public List<List<Object>> getRows() { return rows; }
    public void setRows(List<List<Object>> rows) { this.rows = rows; }

    public List<Integer> getIndex() { return index; }
    public void setIndex(List<Integer> index) { this.index = index; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
