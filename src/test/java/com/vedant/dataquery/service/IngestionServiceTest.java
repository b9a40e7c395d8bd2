package com.vedant.dataquery.service;

import com.vedant.dataquery.TestFiles;
import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.format.FormatReaderRegistry;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.QuotingMode;
import com.vedant.dataquery.model.SourceFile;
import com.vedant.dataquery.model.SpreadsheetOptions;
import com.vedant.dataquery.model.TextOptions;
import com.vedant.dataquery.session.WorkspaceSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IngestionServiceTest {

    private final IngestionService service = new IngestionService(FormatReaderRegistry.withDefaults());
    private final WorkspaceSession session = new WorkspaceSession("s1", DuckDbEngine.inMemory());

    @AfterEach
    void close() {
        session.close();
    }

    private static SourceFile csv(String name, String text) {
        return new SourceFile(name, TestFiles.text(text));
    }

    private void assertCatalogMatchesEngine() {
        assertEquals(new HashSet<>(session.engine().tableNames()), session.catalog().list().keySet());
    }

    @Test
    void planDropsRepeatedNamesAndFlagsOptionUnits() {
        IngestionPlan plan = service.plan(List.of(
                csv("a.csv", "x\n1\n"),
                csv("a.csv", "y\n2\n"),
                new SourceFile("data.json", TestFiles.text("[{\"k\":1}]")),
                new SourceFile("readme.md", TestFiles.text("# hi"))));

        assertEquals(2, plan.units().size());
        assertTrue(plan.units().get(0).needsOptions());
        assertFalse(plan.units().get(1).needsOptions());
        assertEquals(List.of("readme.md not loaded. Unsupported file format"), plan.excluded());
    }

    @Test
    void loadsArchiveMembersAndSkipsUnsupportedOnes() {
        byte[] zip = TestFiles.zip("data.csv", TestFiles.text("a,b\n1,2\n"), "docs/notes.pdf", new byte[]{1});
        IngestionReport report = service.synchronize(session, List.of(new SourceFile("bundle.zip", zip)),
                LoadOptionsProvider.defaults());

        assertEquals(List.of("Loaded bundle.zip - data.csv as table(s): bundle_zip_data_csv"), report.loaded());
        assertEquals(List.of("bundle.zip - docs/notes.pdf not loaded. Unsupported file format"), report.excluded());
        assertEquals(Map.of("bundle_zip_data_csv", "bundle.zip"), report.tables());
        assertCatalogMatchesEngine();
    }

    @Test
    void corruptArchiveIsReportedAsWhole() {
        IngestionReport report = service.synchronize(session,
                List.of(new SourceFile("broken.zip", TestFiles.text("nope")), csv("ok.csv", "a\n1\n")),
                LoadOptionsProvider.defaults());

        assertEquals(1, report.excluded().size());
        assertTrue(report.excluded().get(0).startsWith("Error loading file broken.zip"));
        assertEquals(Map.of("ok_csv", "ok.csv"), report.tables());
    }

    @Test
    void everySheetBecomesATable() {
        LoadOptionsProvider provider = new MapLoadOptionsProvider(
                Map.of("book.xlsx", new SpreadsheetOptions(Map.of("Feb", false))));
        IngestionReport report = service.synchronize(session,
                List.of(new SourceFile("book.xlsx", TestFiles.janFebWorkbook())), provider);

        assertEquals(List.of("Loaded book.xlsx as table(s): book_xlsx_jan, book_xlsx_feb"), report.loaded());
        assertEquals(List.of("col_1"), session.engine().query("SELECT * FROM book_xlsx_feb").columnNames());
    }

    @Test
    void withdrawnFileLosesItsTables() {
        service.synchronize(session, List.of(csv("a.csv", "x\n1\n"), csv("b.csv", "y\n2\n")),
                LoadOptionsProvider.defaults());
        assertEquals(List.of("a_csv", "b_csv"), session.engine().tableNames());

        IngestionReport report = service.synchronize(session, List.of(csv("a.csv", "x\n1\n")),
                LoadOptionsProvider.defaults());

        assertEquals(List.of("Removed file: b.csv and its associated tables"), report.removed());
        assertTrue(report.loaded().isEmpty(), "a.csv is already loaded");
        assertEquals(List.of("a_csv"), session.engine().tableNames());
        assertEquals(List.of("a.csv"), session.getUploadedFiles());
        assertCatalogMatchesEngine();
    }

    @Test
    void badSettingsAreReportedAndRetriedOnNextRound() {
        SourceFile bad = csv("bad.csv", "a,b\n1,2\n3,4,5\n");
        IngestionReport first = service.synchronize(session, List.of(bad), LoadOptionsProvider.defaults());
        assertEquals(List.of("bad.csv not loaded. Please check file settings."), first.excluded());
        assertTrue(session.catalog().list().isEmpty());

        LoadOptions semicolon = new TextOptions(false, ";", QuotingMode.MINIMAL, '"');
        IngestionReport second = service.synchronize(session, List.of(bad),
                new MapLoadOptionsProvider(Map.of("bad.csv", semicolon)));
        assertEquals(List.of("Loaded bad.csv as table(s): bad_csv"), second.loaded());
    }

    @Test
    void emptyUploadListResetsWorkspace() {
        service.synchronize(session, List.of(csv("a.csv", "x\n1\n")), LoadOptionsProvider.defaults());

        IngestionReport report = service.synchronize(session, List.of(), LoadOptionsProvider.defaults());

        assertEquals(List.of("Removed file: a.csv and its associated tables"), report.removed());
        assertTrue(session.engine().tableNames().isEmpty());
        assertTrue(session.getUploadedFiles().isEmpty());
    }

    @Test
    void removeWithdrawsOneFile() {
        service.synchronize(session, List.of(csv("a.csv", "x\n1\n"), csv("b.csv", "y\n2\n")),
                LoadOptionsProvider.defaults());

        IngestionReport report = service.remove(session, "a.csv");

        assertEquals(Map.of("b_csv", "b.csv"), report.tables());
        assertEquals(List.of("b.csv"), session.getUploadedFiles());
        assertCatalogMatchesEngine();
    }
}
