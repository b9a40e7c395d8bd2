package com.vedant.dataquery.format;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parquet written by a scratch DuckDB database with COPY ... (FORMAT PARQUET).
 */
public class ParquetFormatWriter implements FormatWriter {

    private static final Logger logger = LoggerFactory.getLogger(ParquetFormatWriter.class);
    private static final String TABLE = "query_result";

    @Override
    public FileFormat format() {
        return FileFormat.PARQUET;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        Path tmp = Files.createTempFile("dataquery-", ".parquet");
        try (DuckDbEngine scratch = DuckDbEngine.inMemory()) {
            scratch.createTable(TABLE, table);
            scratch.execute("COPY " + DuckDbEngine.quoteIdentifier(TABLE) + " TO "
                    + DuckDbEngine.quoteLiteral(tmp.toString()) + " (FORMAT PARQUET)");
            Files.copy(tmp, out);
        } finally {
            TempFiles.delete(tmp, logger);
        }
    }
}
