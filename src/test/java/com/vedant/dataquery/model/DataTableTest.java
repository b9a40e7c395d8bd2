package com.vedant.dataquery.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataTableTest {

    private static final List<Column> COLUMNS = List.of(
            new Column("id", ColumnType.BIGINT),
            new Column("day", ColumnType.DATE),
            new Column("ok", ColumnType.BOOLEAN));

    @Test
    void coercesValuesToColumnTypes() {
        DataTable t = DataTable.of(COLUMNS, List.of(Arrays.asList(7, "2024-02-01", "true")));
        assertEquals(7L, t.value(0, 0));
        assertEquals(LocalDate.of(2024, 2, 1), t.value(0, 1));
        assertEquals(Boolean.TRUE, t.value(0, 2));
    }

    @Test
    void rejectsWrongWidthAndBadValues() {
        assertThrows(IllegalArgumentException.class,
                () -> DataTable.of(COLUMNS, List.of(Arrays.asList(1, "2024-02-01"))));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DataTable.of(COLUMNS, List.of(Arrays.asList("x", null, null))));
        assertTrue(ex.getMessage().contains("'id'"));
    }

    @Test
    void rejectsDuplicateColumnNames() {
        List<Column> dup = List.of(new Column("a", ColumnType.VARCHAR), new Column("a", ColumnType.VARCHAR));
        assertThrows(IllegalArgumentException.class, () -> DataTable.empty(dup));
    }

    @Test
    void namesHeaderlessAndBlankColumns() {
        assertEquals(List.of("col_1", "col_2", "col_3"), DataTable.positionalNames(3));
        assertEquals(List.of("a", "Unnamed: 1", "a_2"), DataTable.uniqueNames(Arrays.asList("a", " ", "a")));
    }

    @Test
    void textOptionsExpandTabAndCheckQuote() {
        assertEquals("\t", new TextOptions(true, "\\t", QuotingMode.MINIMAL, '"').delimiter());
        assertThrows(IllegalArgumentException.class, () -> new TextOptions(true, "", QuotingMode.MINIMAL, '"'));
        assertThrows(IllegalArgumentException.class, () -> new TextOptions(true, "\"", QuotingMode.MINIMAL, '"'));
        assertEquals(QuotingMode.NONNUMERIC, QuotingMode.parse("quote_nonnumeric"));
    }
}
