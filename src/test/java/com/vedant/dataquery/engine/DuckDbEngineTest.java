package com.vedant.dataquery.engine;

import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuckDbEngineTest {

    private final DuckDbEngine engine = new DuckDbEngine(DuckDbEngine.IN_MEMORY_URL, 2);

    @AfterEach
    void close() {
        engine.close();
    }

    @Test
    void createsTableAndInsertsInBatches() {
        List<List<Object>> rows = new ArrayList<>();
        for (long i = 1; i <= 5; i++) rows.add(Arrays.asList(i, i % 2 == 0 ? null : "v" + i, i * 1.5));
        DataTable t = DataTable.of(List.of(
                new Column("id", ColumnType.BIGINT),
                new Column("label", ColumnType.VARCHAR),
                new Column("x", ColumnType.DOUBLE)), rows);

        engine.createTable("my table", t);

        assertTrue(engine.tableExists("my table"));
        DataTable back = engine.query("SELECT * FROM \"my table\" ORDER BY id");
        assertEquals(t.columns(), back.columns());
        assertEquals(t.rows(), back.rows());
    }

    @Test
    void listsAndDropsTables() {
        DataTable one = DataTable.of(List.of(new Column("a", ColumnType.BIGINT)), List.of(List.of(1L)));
        engine.createTable("b_t", one);
        engine.createTable("a_t", one);
        assertEquals(List.of("a_t", "b_t"), engine.tableNames());

        engine.dropTable("a_t");
        engine.dropTable("never_existed");
        assertEquals(List.of("b_t"), engine.tableNames());
        assertFalse(engine.tableExists("a_t"));
    }

    @Test
    void duplicateResultLabelsAreMadeUnique() {
        DataTable t = engine.query("SELECT 1 AS a, 2 AS a");
        assertEquals(List.of("a", "a_2"), t.columnNames());
        assertEquals(ColumnType.BIGINT, t.columns().get(0).type());
        assertEquals(1L, t.value(0, 0));
    }

    @Test
    void engineErrorsSurfaceAsDataAccessException() {
        assertThrows(DataAccessException.class, () -> engine.query("SELECT * FROM missing"));
    }

    @Test
    void quotesIdentifiersAndLiterals() {
        assertEquals("\"a\"\"b\"", DuckDbEngine.quoteIdentifier("a\"b"));
        assertEquals("'it''s'", DuckDbEngine.quoteLiteral("it's"));
    }
}
