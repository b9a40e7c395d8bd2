package com.vedant.dataquery.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per sheet header flags for spreadsheets. Sheets without an entry are read with a header row.
 */
public record SpreadsheetOptions(Map<String, Boolean> headerBySheet) implements LoadOptions {

    public SpreadsheetOptions {
        headerBySheet = headerBySheet == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headerBySheet));
    }

    public static SpreadsheetOptions allWithHeader() {
        return new SpreadsheetOptions(Collections.emptyMap());
    }

    public boolean headerPresent(String sheetName) {
        Boolean h = headerBySheet.get(sheetName);
        return h == null || h;
    }
}
