package com.vedant.dataquery.exception;

import com.vedant.dataquery.model.FileFormat;

public class UnsupportedFormatException extends IngestionException {

    private final FileFormat format;

    public UnsupportedFormatException(String fileName, FileFormat format) {
        super(fileName + " not loaded. Unsupported file format");
        this.format = format;
    }

    public FileFormat getFormat() {
        return format;
    }
}
