package com.vedant.dataquery.service;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an ingestion round, ready to be displayed.
 *
 * @param loaded   one line per unit that produced tables
 * @param excluded one line per unit, member or sheet that produced nothing
 * @param removed  one line per withdrawn file
 * @param warnings engine problems that did not stop the round
 * @param tables   catalog snapshot after the round
 */
public record IngestionReport(
        List<String> loaded,
        List<String> excluded,
        List<String> removed,
        List<String> warnings,
        Map<String, String> tables
) {

    public IngestionReport {
        loaded = List.copyOf(loaded);
        excluded = List.copyOf(excluded);
        removed = List.copyOf(removed);
        warnings = List.copyOf(warnings);
    }

    public String loadedText() {
        return String.join("\n", loaded);
    }

    public String excludedText() {
        return String.join("\n", excluded);
    }
}
