package com.vedant.dataquery.service;

import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.UnitLabel;

import java.util.List;

/**
 * Supplies the load options of one unit, usually by asking the user. Only consulted for formats
 * that take options (csv, txt, xlsx).
 */
@FunctionalInterface
public interface LoadOptionsProvider {

    /**
     * @param sheetNames the workbook's sheets for spreadsheets, empty otherwise
     * @return options for the unit, or null to use the format's defaults
     */
    LoadOptions optionsFor(UnitLabel label, FileFormat format, List<String> sheetNames);

    static LoadOptionsProvider defaults() {
        return (label, format, sheetNames) -> LoadOptions.defaultsFor(format);
    }
}
