package com.vedant.dataquery.service;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.UnitLabel;
import com.vedant.dataquery.util.NameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Which tables exist in a session's engine and which uploaded file each one came from.
 * Entries and engine tables are created and dropped together.
 */
public class TableCatalog {

    private static final Logger logger = LoggerFactory.getLogger(TableCatalog.class);

    static final String FALLBACK_NAME = "table";

    private final DuckDbEngine engine;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public TableCatalog(DuckDbEngine engine) {
        this.engine = engine;
    }

    public record RetractionResult(List<String> tables, List<String> warnings) {}

    /**
     * Installs the table under a fresh name derived from the unit label and sheet, and records
     * where it came from.
     *
     * @return the registered table name
     * @throws IngestionException if the table has no columns or the engine rejects it
     */
    public String register(UnitLabel label, String sheetName, DataTable table) {
        if (table.columnCount() == 0) {
            throw new IngestionException("No columns found");
        }
        String base = NameSanitizer.tableName(label, sheetName);
        if (base.isEmpty()) base = FALLBACK_NAME;
        String name = base;
        int suffix = 1;
        while (entries.containsKey(name) || engine.tableExists(name)) {
            name = base + "_" + (++suffix) + "_";
        }
        if (!name.equals(base)) {
            logger.info("Table name {} already taken, registering {} as {}", base, label.display(), name);
        }

        try {
            engine.createTable(name, table);
        } catch (DataAccessException ex) {
            logger.error("Could not create table {} for {}", name, label.display(), ex);
            dropQuietly(name);
            throw new IngestionException("Could not register table " + name + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
        entries.put(name, label.sourceName());
        logger.info("Registered table {} ({} rows) from {}", name, table.rowCount(), label.display());
        return name;
    }

    /**
     * Drops the table if present and forgets it. Engine failures come back as a warning; the
     * entry is removed either way.
     */
    public Optional<String> retract(String tableName) {
        entries.remove(tableName);
        try {
            engine.dropTable(tableName);
            logger.info("Dropped table {}", tableName);
            return Optional.empty();
        } catch (DataAccessException ex) {
            logger.warn("Could not drop table {}", tableName, ex);
            return Optional.of("Could not drop table " + tableName + ": " + ex.getMostSpecificCause().getMessage());
        }
    }

    /** Retracts every table whose source is {@code sourceName}. */
    public RetractionResult retractBySource(String sourceName) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, String> e : entries.entrySet()) {
            if (e.getValue().equals(sourceName)) names.add(e.getKey());
        }
        List<String> warnings = new ArrayList<>();
        for (String name : names) {
            retract(name).ifPresent(warnings::add);
        }
        return new RetractionResult(names, warnings);
    }

    public List<String> clear() {
        List<String> warnings = new ArrayList<>();
        for (String name : new ArrayList<>(entries.keySet())) {
            retract(name).ifPresent(warnings::add);
        }
        return warnings;
    }

    /** Snapshot of table name to source file, in registration order. */
    public Map<String, String> list() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public boolean contains(String tableName) {
        return entries.containsKey(tableName);
    }

    public Optional<String> sourceOf(String tableName) {
        return Optional.ofNullable(entries.get(tableName));
    }

    public boolean hasTablesFrom(String sourceName) {
        return entries.containsValue(sourceName);
    }

    public int size() {
        return entries.size();
    }

    private void dropQuietly(String name) {
        try {
            engine.dropTable(name);
        } catch (DataAccessException dropEx) {
            logger.warn("Could not clean up table {} after a failed registration", name, dropEx);
        }
    }
}
