package com.vedant.dataquery.model;

import java.util.Objects;

/**
 * Composite label of one ingestion unit: the enclosing archive (if any) and the file name.
 */
public record UnitLabel(String archiveName, String fileName) {

    public UnitLabel {
        Objects.requireNonNull(fileName, "fileName");
    }

    public static UnitLabel of(String fileName) {
        return new UnitLabel(null, fileName);
    }

    public static UnitLabel inArchive(String archiveName, String fileName) {
        return new UnitLabel(archiveName, fileName);
    }

    public boolean inArchive() {
        return archiveName != null;
    }

    /** Name of the top level upload this unit came from. */
    public String sourceName() {
        return inArchive() ? archiveName : fileName;
    }

    public String display() {
        return inArchive() ? archiveName + " - " + fileName : fileName;
    }

    @Override
    public String toString() {
        return display();
    }
}
