package com.vedant.dataquery.format;

import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;

import java.util.List;

/**
 * Turns the raw bytes of one file into one or more tables.
 * Implementations either return complete tables or throw; they never return partial data.
 */
public interface FormatReader {

    FileFormat format();

    /**
     * @throws com.vedant.dataquery.exception.IngestionException if the content cannot be read
     */
    List<ReadResult> read(byte[] content, LoadOptions options);
}
