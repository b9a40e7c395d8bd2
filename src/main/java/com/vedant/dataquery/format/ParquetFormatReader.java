package com.vedant.dataquery.format;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parquet through a scratch DuckDB database, which keeps the column types stored in the file.
 */
public class ParquetFormatReader implements FormatReader {

    private static final Logger logger = LoggerFactory.getLogger(ParquetFormatReader.class);

    @Override
    public FileFormat format() {
        return FileFormat.PARQUET;
    }

    @Override
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        Path tmp = null;
        try (DuckDbEngine scratch = DuckDbEngine.inMemory()) {
            tmp = Files.createTempFile("dataquery-", ".parquet");
            Files.write(tmp, content);
            DataTable table = scratch.query("SELECT * FROM read_parquet(" + DuckDbEngine.quoteLiteral(tmp.toString()) + ")");
            return List.of(ReadResult.single(table));
        } catch (IOException | DataAccessException e) {
            throw new IngestionException("Could not read parquet data: " + e.getMessage(), e);
        } finally {
            TempFiles.delete(tmp, logger);
        }
    }
}
