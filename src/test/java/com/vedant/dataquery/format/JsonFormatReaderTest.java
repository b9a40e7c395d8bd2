package com.vedant.dataquery.format;

import com.vedant.dataquery.TestFiles;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.NoOptions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFormatReaderTest {

    private final JsonFormatReader reader = new JsonFormatReader();

    private DataTable read(String json) {
        return reader.read(TestFiles.text(json), NoOptions.INSTANCE).get(0).table();
    }

    @Test
    void flattensNestedObjects() {
        DataTable t = read("[{\"id\":1,\"name\":\"a\",\"address\":{\"city\":\"X\",\"zip\":\"01\"}},"
                + "{\"id\":2,\"name\":\"b\",\"active\":true}]");
        assertEquals(List.of("id", "name", "address.city", "address.zip", "active"), t.columnNames());
        assertEquals(ColumnType.BIGINT, t.columns().get(0).type());
        assertEquals(ColumnType.BOOLEAN, t.columns().get(4).type());
        assertEquals(Arrays.asList(1L, "a", "X", "01", null), t.rows().get(0));
        assertEquals(Arrays.asList(2L, "b", null, null, true), t.rows().get(1));
    }

    @Test
    void singleObjectIsOneRow() {
        DataTable t = read("{\"x\": 1.5, \"tags\": [\"a\", \"b\"]}");
        assertEquals(1, t.rowCount());
        assertEquals(1.5, t.value(0, 0));
        assertEquals("[\"a\",\"b\"]", t.value(0, 1));
    }

    @Test
    void scalarElementsGoToValueColumn() {
        DataTable t = read("[1, 2, 3]");
        assertEquals(List.of("value"), t.columnNames());
        assertEquals(3, t.rowCount());
    }

    @Test
    void rejectsScalarRootAndBrokenInput() {
        assertThrows(IngestionException.class, () -> read("5"));
        assertThrows(IngestionException.class, () -> read("{\"a\":"));
    }
}
