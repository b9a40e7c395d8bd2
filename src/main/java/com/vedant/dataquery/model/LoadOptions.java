package com.vedant.dataquery.model;

/**
 * Format specific loading configuration, produced by whoever collects options from the user.
 */
public sealed interface LoadOptions permits TextOptions, SpreadsheetOptions, NoOptions {

    static LoadOptions defaultsFor(FileFormat format) {
        return switch (format) {
            case CSV, TXT -> TextOptions.defaults();
            case XLSX -> SpreadsheetOptions.allWithHeader();
            default -> NoOptions.INSTANCE;
        };
    }
}
