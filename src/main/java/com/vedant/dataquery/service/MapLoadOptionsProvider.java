package com.vedant.dataquery.service;

import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.SpreadsheetOptions;
import com.vedant.dataquery.model.TextOptions;
import com.vedant.dataquery.model.UnitLabel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options collected up front, keyed by {@link UnitLabel#display()}. Units without an entry, or
 * with options of the wrong family for their format, get the defaults.
 */
public class MapLoadOptionsProvider implements LoadOptionsProvider {

    private final Map<String, LoadOptions> byLabel;

    public MapLoadOptionsProvider(Map<String, LoadOptions> byLabel) {
        this.byLabel = byLabel == null ? Collections.emptyMap() : new LinkedHashMap<>(byLabel);
    }

    @Override
    public LoadOptions optionsFor(UnitLabel label, FileFormat format, List<String> sheetNames) {
        LoadOptions options = byLabel.get(label.display());
        boolean fits = switch (format) {
            case CSV, TXT -> options instanceof TextOptions;
            case XLSX -> options instanceof SpreadsheetOptions;
            default -> false;
        };
        return fits ? options : LoadOptions.defaultsFor(format);
    }
}
