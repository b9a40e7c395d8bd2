package com.vedant.dataquery.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, row ordered relation. Every row has exactly one value per column and every value
 * is either null or the canonical Java class of its column type.
 */
public final class DataTable {

    private final List<Column> columns;
    private final List<List<Object>> rows;

    private DataTable(List<Column> columns, List<List<Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Builds a table, coercing each value to its column type.
     *
     * @throws IllegalArgumentException on a row of the wrong width or an unconvertible value
     */
    public static DataTable of(List<Column> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Set<String> seen = new HashSet<>();
        for (Column c : columns) {
            if (!seen.add(c.name())) {
                throw new IllegalArgumentException("Duplicate column name: " + c.name());
            }
        }
        List<List<Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            int rowNum = 0;
            for (List<?> row : rows) {
                rowNum++;
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException(String.format(
                            "Row %d has %d values but the table has %d columns", rowNum, row.size(), columns.size()));
                }
                Object[] values = new Object[columns.size()];
                for (int c = 0; c < values.length; c++) {
                    ColumnType type = columns.get(c).type();
                    try {
                        values[c] = type.coerce(row.get(c));
                    } catch (RuntimeException ex) {
                        throw new IllegalArgumentException(String.format(
                                "Row %d, column '%s': cannot convert '%s' to %s",
                                rowNum, columns.get(c).name(), row.get(c), type), ex);
                    }
                }
                copy.add(Collections.unmodifiableList(Arrays.asList(values)));
            }
        }
        return new DataTable(List.copyOf(columns), Collections.unmodifiableList(copy));
    }

    public static DataTable empty(List<Column> columns) {
        return of(columns, Collections.emptyList());
    }

    public List<Column> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column c : columns) names.add(c.name());
        return names;
    }

    public Object value(int row, int column) {
        return rows.get(row).get(column);
    }

    /** Same rows and types under new column names. */
    public DataTable withColumnNames(List<String> names) {
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " column names, got " + names.size());
        }
        List<Column> renamed = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            renamed.add(new Column(names.get(i), columns.get(i).type()));
        }
        return of(renamed, rows);
    }

    /** Positional names col_1..col_N used when a file has no header row. */
    public static List<String> positionalNames(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) names.add("col_" + i);
        return names;
    }

    /**
     * Makes header names usable as column names: blanks become {@code Unnamed: i} and repeats get
     * a numeric suffix.
     */
    public static List<String> uniqueNames(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = raw.get(i);
            if (name == null || name.isBlank()) name = "Unnamed: " + i;
            String candidate = name;
            int suffix = 1;
            while (used.contains(candidate)) {
                candidate = name + "_" + (++suffix);
            }
            used.add(candidate);
            out.add(candidate);
        }
        return out;
    }

    @Override
    public String toString() {
        return "DataTable" + columnNames() + "[" + rows.size() + " rows]";
    }
}
