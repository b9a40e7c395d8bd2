package com.vedant.dataquery.service;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.format.FormatReader;
import com.vedant.dataquery.format.FormatReaderRegistry;
import com.vedant.dataquery.format.ReadResult;
import com.vedant.dataquery.format.XlsxFormatReader;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.NoOptions;
import com.vedant.dataquery.model.SourceFile;
import com.vedant.dataquery.model.UnitLabel;
import com.vedant.dataquery.session.WorkspaceSession;
import com.vedant.dataquery.util.ArchiveExpander;
import com.vedant.dataquery.util.ArchiveExpander.ArchiveMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns uploaded files into catalog tables and retracts the tables of withdrawn files.
 */
@Service
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private final FormatReaderRegistry readers;

    public IngestionService(FormatReaderRegistry readers) {
        this.readers = readers;
    }

    /**
     * Works out the units of a batch: drops repeated names (first one wins), expands archives
     * and reads sheet names. Needs no options and touches no session.
     */
    public IngestionPlan plan(List<SourceFile> files) {
        List<IngestionPlan.Unit> units = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (SourceFile file : files) {
            if (!seen.add(file.name())) {
                logger.debug("Skipping repeated upload {}", file.name());
                continue;
            }
            FileFormat format = file.format();
            if (format.isArchive()) {
                planArchive(file, units, excluded);
            } else if (readers.supports(format)) {
                addUnit(UnitLabel.of(file.name()), format, file.content(), units, excluded);
            } else {
                excluded.add(file.name() + " not loaded. Unsupported file format");
            }
        }
        return new IngestionPlan(units, excluded);
    }

    private void planArchive(SourceFile archive, List<IngestionPlan.Unit> units, List<String> excluded) {
        List<IngestionPlan.Unit> members = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        try {
            Iterator<ArchiveMember> it = ArchiveExpander.expand(archive);
            while (it.hasNext()) {
                ArchiveMember m = it.next();
                FileFormat format = m.format();
                if (readers.supports(format)) {
                    addUnit(UnitLabel.inArchive(archive.name(), m.name()), format, m.content(), members, skipped);
                } else {
                    skipped.add(archive.name() + " - " + m.path() + " not loaded. Unsupported file format");
                }
            }
        } catch (IngestionException ex) {
            logger.error("Archive {} could not be expanded", archive.name(), ex);
            excluded.add("Error loading file " + archive.name() + ": " + ex.getMessage());
            return;
        }
        units.addAll(members);
        excluded.addAll(skipped);
    }

    private void addUnit(UnitLabel label, FileFormat format, byte[] content,
                         List<IngestionPlan.Unit> units, List<String> excluded) {
        List<String> sheets = Collections.emptyList();
        if (format == FileFormat.XLSX) {
            try {
                sheets = XlsxFormatReader.sheetNames(content);
            } catch (IngestionException ex) {
                logger.error("Workbook {} could not be opened", label.display(), ex);
                excluded.add("Error loading file " + label.display() + ": " + ex.getMessage());
                return;
            }
        }
        units.add(new IngestionPlan.Unit(label, format, sheets, content));
    }

    /**
     * Reads every unit of the plan and registers the resulting tables in the session catalog.
     * A failing unit or sheet is reported and skipped; the rest of the batch goes on.
     */
    public IngestionReport load(WorkspaceSession session, IngestionPlan plan, LoadOptionsProvider optionsProvider) {
        synchronized (session) {
            List<String> loaded = new ArrayList<>();
            List<String> excluded = new ArrayList<>(plan.excluded());
            for (IngestionPlan.Unit unit : plan.units()) {
                loadUnit(session, unit, optionsProvider, loaded, excluded);
            }
            return new IngestionReport(loaded, excluded, List.of(), List.of(), session.catalog().list());
        }
    }

    private void loadUnit(WorkspaceSession session, IngestionPlan.Unit unit, LoadOptionsProvider optionsProvider,
                          List<String> loaded, List<String> excluded) {
        UnitLabel label = unit.label();
        LoadOptions options = NoOptions.INSTANCE;
        if (unit.needsOptions()) {
            options = optionsProvider.optionsFor(label, unit.format(), unit.sheetNames());
            if (options == null) options = LoadOptions.defaultsFor(unit.format());
        }

        List<ReadResult> results;
        try {
            FormatReader reader = readers.readerFor(label.fileName(), unit.format());
            results = reader.read(unit.content(), options);
        } catch (IngestionException ex) {
            if (ex.isRecoverable()) {
                logger.warn("{} not loaded with {}: {}", label.display(), options, ex.getMessage());
                excluded.add(label.display() + " not loaded. Please check file settings.");
            } else {
                logger.error("Error loading file {}", label.display(), ex);
                excluded.add("Error loading file " + label.display() + ": " + ex.getMessage());
            }
            return;
        } catch (RuntimeException ex) {
            logger.error("Error loading file {}", label.display(), ex);
            excluded.add("Error loading file " + label.display() + ": " + ex.getMessage());
            return;
        }

        List<String> tables = new ArrayList<>(results.size());
        for (ReadResult r : results) {
            try {
                tables.add(session.catalog().register(label, r.sheetName(), r.table()));
            } catch (IngestionException ex) {
                String what = r.sheetName() == null ? label.display() : label.display() + " - " + r.sheetName();
                logger.warn("{} not registered: {}", what, ex.getMessage());
                excluded.add(what + " not loaded. " + ex.getMessage());
            }
        }
        if (!tables.isEmpty()) {
            loaded.add("Loaded " + label.display() + " as table(s): " + String.join(", ", tables));
        }
    }

    /**
     * Brings the session in line with the complete current upload list: tables of files no
     * longer present are retracted, files not seen before (or that produced no table) are loaded.
     * An empty list resets the session.
     */
    public IngestionReport synchronize(WorkspaceSession session, List<SourceFile> current,
                                       LoadOptionsProvider optionsProvider) {
        synchronized (session) {
            List<String> previous = session.getUploadedFiles();
            List<String> currentNames = distinctNames(current);
            List<String> removed = new ArrayList<>();
            List<String> warnings = new ArrayList<>();

            if (currentNames.isEmpty()) {
                for (String name : previous) {
                    removed.add(removalMessage(name));
                }
                warnings.addAll(session.reset());
                logger.info("Upload list is empty, workspace {} reset", session.getId());
                return new IngestionReport(List.of(), List.of(), removed, warnings, session.catalog().list());
            }

            for (String name : previous) {
                if (!currentNames.contains(name)) {
                    retractFile(session, name, removed, warnings);
                }
            }

            List<SourceFile> pending = new ArrayList<>();
            for (SourceFile file : current) {
                boolean known = previous.contains(file.name()) && session.catalog().hasTablesFrom(file.name());
                if (!known) pending.add(file);
            }
            IngestionReport loadReport = load(session, plan(pending), optionsProvider);
            session.setUploadedFiles(currentNames);

            return new IngestionReport(loadReport.loaded(), loadReport.excluded(), removed, warnings,
                    session.catalog().list());
        }
    }

    /** Withdraws a single file from the upload list. */
    public IngestionReport remove(WorkspaceSession session, String fileName) {
        synchronized (session) {
            List<String> removed = new ArrayList<>();
            List<String> warnings = new ArrayList<>();
            List<String> remaining = new ArrayList<>(session.getUploadedFiles());
            if (remaining.remove(fileName) || session.catalog().hasTablesFrom(fileName)) {
                retractFile(session, fileName, removed, warnings);
            }
            session.setUploadedFiles(remaining);
            return new IngestionReport(List.of(), List.of(), removed, warnings, session.catalog().list());
        }
    }

    private void retractFile(WorkspaceSession session, String name, List<String> removed, List<String> warnings) {
        TableCatalog.RetractionResult result = session.catalog().retractBySource(name);
        warnings.addAll(result.warnings());
        removed.add(removalMessage(name));
        logger.info("Removed file {} and tables {}", name, result.tables());
    }

    private static String removalMessage(String name) {
        return "Removed file: " + name + " and its associated tables";
    }

    private static List<String> distinctNames(List<SourceFile> files) {
        Map<String, Boolean> names = new LinkedHashMap<>();
        for (SourceFile f : files) names.putIfAbsent(f.name(), Boolean.TRUE);
        return new ArrayList<>(names.keySet());
    }
}
