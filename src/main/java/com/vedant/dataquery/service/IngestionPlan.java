package com.vedant.dataquery.service;

import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.UnitLabel;

import java.util.List;

/**
 * What an upload batch will turn into, worked out before any option is collected.
 *
 * @param units    readable units in upload order
 * @param excluded messages for files and archive members that will not be loaded
 */
public record IngestionPlan(List<Unit> units, List<String> excluded) {

    public IngestionPlan {
        units = List.copyOf(units);
        excluded = List.copyOf(excluded);
    }

    /**
     * One file or archive member to parse.
     *
     * @param sheetNames workbook sheets for spreadsheets, empty otherwise
     */
    public record Unit(UnitLabel label, FileFormat format, List<String> sheetNames, byte[] content) {

        public Unit {
            sheetNames = List.copyOf(sheetNames);
        }

        public boolean needsOptions() {
            return format.needsOptions();
        }
    }
}
