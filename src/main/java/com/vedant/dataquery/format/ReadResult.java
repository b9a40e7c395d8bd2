package com.vedant.dataquery.format;

import com.vedant.dataquery.model.DataTable;

/**
 * One table produced by a reader. {@code sheetName} is set only for spreadsheets.
 */
public record ReadResult(String sheetName, DataTable table) {

    public static ReadResult single(DataTable table) {
        return new ReadResult(null, table);
    }
}
