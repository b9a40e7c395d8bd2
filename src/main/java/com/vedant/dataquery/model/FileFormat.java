package com.vedant.dataquery.model;

import java.util.Locale;

/**
 * Closed set of file formats the workspace knows about. Anything else maps to UNSUPPORTED.
 */
public enum FileFormat {
    AVRO("avro", "application/octet-stream"),
    CSV("csv", "text/csv"),
    JSON("json", "application/json"),
    PARQUET("parquet", "application/octet-stream"),
    TXT("txt", "text/csv"),
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    XML("xml", "application/xml"),
    ZIP("zip", null),
    UNSUPPORTED(null, null);

    private final String extension;
    private final String mimeType;

    FileFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    public boolean isArchive() {
        return this == ZIP;
    }

    public boolean isExportable() {
        return mimeType != null;
    }

    /** Formats whose loading depends on user supplied options. */
    public boolean needsOptions() {
        return this == CSV || this == TXT || this == XLSX;
    }

    public static FileFormat fromFileName(String fileName) {
        if (fileName == null) return UNSUPPORTED;
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return UNSUPPORTED;
        return fromExtension(fileName.substring(dot + 1));
    }

    public static FileFormat fromExtension(String extension) {
        if (extension == null) return UNSUPPORTED;
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        for (FileFormat f : values()) {
            if (ext.equals(f.extension)) return f;
        }
        return UNSUPPORTED;
    }
}
