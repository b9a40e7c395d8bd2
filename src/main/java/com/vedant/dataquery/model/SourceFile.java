package com.vedant.dataquery.model;

import java.util.Objects;

/**
 * An uploaded file: its display name and raw bytes.
 */
public record SourceFile(String name, byte[] content) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
    }

    public FileFormat format() {
        return FileFormat.fromFileName(name);
    }
}
