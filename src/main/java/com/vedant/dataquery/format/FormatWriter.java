package com.vedant.dataquery.format;

import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a whole table in one format. Callers hand in a fresh buffer and discard it on failure.
 */
public interface FormatWriter {

    FileFormat format();

    void write(DataTable table, ExportOptions options, OutputStream out) throws IOException;
}
