package com.vedant.dataquery.format;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.NoOptions;
import com.vedant.dataquery.model.SpreadsheetOptions;
import org.apache.avro.Schema;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tables written by the avro, parquet and xlsx writers come back unchanged through the readers.
 */
class BinaryFormatsTest {

    private static final DataTable SAMPLE = DataTable.of(
            List.of(new Column("id", ColumnType.BIGINT),
                    new Column("name", ColumnType.VARCHAR),
                    new Column("score", ColumnType.DOUBLE),
                    new Column("ok", ColumnType.BOOLEAN),
                    new Column("day", ColumnType.DATE),
                    new Column("at", ColumnType.TIMESTAMP)),
            List.of(Arrays.asList(1L, "a", 2.5, true, LocalDate.of(2024, 1, 31), LocalDateTime.of(2024, 1, 31, 8, 15, 0)),
                    Arrays.asList(2L, null, null, false, null, null)));

    private static byte[] write(FormatWriter writer, DataTable table) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(table, ExportOptions.defaults(), out);
        return out.toByteArray();
    }

    @Test
    void avroKeepsTypesAndNulls() throws IOException {
        DataTable back = new AvroFormatReader().read(write(new AvroFormatWriter(), SAMPLE), NoOptions.INSTANCE).get(0).table();
        assertEquals(SAMPLE.columns(), back.columns());
        assertEquals(SAMPLE.rows(), back.rows());
    }

    @Test
    void avroSchemaIsNullableRecord() {
        Schema schema = AvroFormatWriter.schemaFor(SAMPLE);
        assertEquals("query_result", schema.getName());
        assertEquals(Schema.Type.UNION, schema.getField("id").schema().getType());
    }

    @Test
    void avroKeepsColumnNamesThatAreNotAvroNames() throws IOException {
        DataTable odd = DataTable.of(
                List.of(new Column("a.b", ColumnType.BIGINT), new Column("total amount", ColumnType.VARCHAR),
                        new Column("a_b", ColumnType.BIGINT), new Column("1st", ColumnType.DOUBLE)),
                List.of(Arrays.asList(1L, "x", 2L, 0.5)));

        Schema schema = AvroFormatWriter.schemaFor(odd);
        assertEquals(List.of("a_b", "total_amount", "a_b_2", "_1st"),
                schema.getFields().stream().map(Schema.Field::name).toList());

        DataTable back = new AvroFormatReader().read(write(new AvroFormatWriter(), odd), NoOptions.INSTANCE).get(0).table();
        assertEquals(odd.columns(), back.columns());
        assertEquals(odd.rows(), back.rows());
    }

    @Test
    void parquetKeepsTypesAndNulls() throws IOException {
        DataTable back = new ParquetFormatReader().read(write(new ParquetFormatWriter(), SAMPLE), NoOptions.INSTANCE).get(0).table();
        assertEquals(SAMPLE.columnNames(), back.columnNames());
        assertEquals(SAMPLE.rows(), back.rows());
    }

    @Test
    void xlsxWritesOneSheetWithHeader() throws IOException {
        DataTable numbers = DataTable.of(
                List.of(new Column("id", ColumnType.BIGINT), new Column("name", ColumnType.VARCHAR)),
                List.of(Arrays.asList(1L, "a"), Arrays.asList(2L, "b")));
        byte[] bytes = write(new XlsxFormatWriter(), numbers);
        assertEquals(List.of("Sheet1"), XlsxFormatReader.sheetNames(bytes));

        DataTable back = new XlsxFormatReader().read(bytes, SpreadsheetOptions.allWithHeader()).get(0).table();
        assertEquals(numbers.columns(), back.columns());
        assertEquals(numbers.rows(), back.rows());
    }

    @Test
    void brokenBinaryInputFails() {
        byte[] junk = "not binary data".getBytes();
        assertThrows(IngestionException.class, () -> new AvroFormatReader().read(junk, NoOptions.INSTANCE));
        assertThrows(IngestionException.class, () -> new ParquetFormatReader().read(junk, NoOptions.INSTANCE));
    }
}
