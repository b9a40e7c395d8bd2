package com.vedant.dataquery.service;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.UnitLabel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TableCatalogTest {

    private static final DataTable ONE_ROW = DataTable.of(
            List.of(new Column("a", ColumnType.BIGINT)), List.of(List.of(1L)));

    private final DuckDbEngine engine = DuckDbEngine.inMemory();
    private final TableCatalog catalog = new TableCatalog(engine);

    @AfterEach
    void close() {
        engine.close();
    }

    private void assertInSyncWithEngine() {
        assertEquals(new HashSet<>(engine.tableNames()), catalog.list().keySet());
    }

    @Test
    void registersUnderSanitizedNameAndRemembersSource() {
        String name = catalog.register(UnitLabel.inArchive("data.zip", "sales.csv"), null, ONE_ROW);
        assertEquals("data_zip_sales_csv", name);
        assertEquals(Optional.of("data.zip"), catalog.sourceOf(name));
        assertTrue(catalog.hasTablesFrom("data.zip"));
        assertInSyncWithEngine();
    }

    @Test
    void collidingNamesGetNumberedSuffix() {
        assertEquals("a_csv", catalog.register(UnitLabel.of("a.csv"), null, ONE_ROW));
        assertEquals("a_csv_2_", catalog.register(UnitLabel.of("a.csv"), null, ONE_ROW));
        assertEquals("a_csv_3_", catalog.register(UnitLabel.of("a.csv"), null, ONE_ROW));
        assertEquals(3, catalog.size());
        assertInSyncWithEngine();
    }

    @Test
    void refusesTableWithoutColumns() {
        IngestionException ex = assertThrows(IngestionException.class,
                () -> catalog.register(UnitLabel.of("empty.json"), null, DataTable.empty(List.of())));
        assertEquals("No columns found", ex.getMessage());
        assertEquals(0, catalog.size());
        assertInSyncWithEngine();
    }

    @Test
    void retractsEverythingFromOneSource() {
        catalog.register(UnitLabel.of("book.xlsx"), "Jan", ONE_ROW);
        catalog.register(UnitLabel.of("book.xlsx"), "Feb", ONE_ROW);
        catalog.register(UnitLabel.of("other.csv"), null, ONE_ROW);

        TableCatalog.RetractionResult result = catalog.retractBySource("book.xlsx");

        assertEquals(List.of("book_xlsx_jan", "book_xlsx_feb"), result.tables());
        assertTrue(result.warnings().isEmpty());
        assertEquals(Map.of("other_csv", "other.csv"), catalog.list());
        assertInSyncWithEngine();
    }

    @Test
    void clearDropsAllTables() {
        catalog.register(UnitLabel.of("a.csv"), null, ONE_ROW);
        catalog.register(UnitLabel.of("b.csv"), null, ONE_ROW);
        assertTrue(catalog.clear().isEmpty());
        assertTrue(engine.tableNames().isEmpty());
        assertEquals(0, catalog.size());
    }

    @Test
    void dropFailureBecomesWarning() {
        DuckDbEngine broken = mock(DuckDbEngine.class);
        doThrow(new DataAccessResourceFailureException("engine gone")).when(broken).dropTable("t");
        TableCatalog c = new TableCatalog(broken);

        Optional<String> warning = c.retract("t");

        assertTrue(warning.isPresent());
        assertTrue(warning.get().contains("engine gone"));
    }

    @Test
    void failedCreateLeavesNoEntry() {
        DuckDbEngine broken = mock(DuckDbEngine.class);
        when(broken.tableExists(anyString())).thenReturn(false);
        doThrow(new DataAccessResourceFailureException("disk full")).when(broken).createTable(eq("a_csv"), any());
        TableCatalog c = new TableCatalog(broken);

        assertThrows(IngestionException.class, () -> c.register(UnitLabel.of("a.csv"), null, ONE_ROW));
        assertEquals(0, c.size());
        verify(broken).dropTable("a_csv");
    }
}
