package com.vedant.dataquery.format;

import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Conversions;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Avro object container files. Nullable unions decode to null values. A field's
 * {@code column_name} property, when present, names the column.
 */
public class AvroFormatReader implements FormatReader {

    private static final Conversions.DecimalConversion DECIMALS = new Conversions.DecimalConversion();

    @Override
    public FileFormat format() {
        return FileFormat.AVRO;
    }

    @Override
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        try (DataFileStream<GenericRecord> stream =
                     new DataFileStream<>(new ByteArrayInputStream(content), new GenericDatumReader<>())) {
            Schema schema = stream.getSchema();
            if (schema.getType() != Schema.Type.RECORD) {
                throw new IngestionException("Avro schema is not a record: " + schema.getType());
            }
            List<Schema.Field> fields = schema.getFields();
            List<Column> columns = new ArrayList<>(fields.size());
            List<Schema> fieldSchemas = new ArrayList<>(fields.size());
            for (Schema.Field f : fields) {
                Schema s = unwrapNullable(f.schema());
                fieldSchemas.add(s);
                String name = f.getProp(AvroFormatWriter.COLUMN_NAME_PROP);
                columns.add(new Column(name != null ? name : f.name(), columnType(s)));
            }

            List<List<Object>> rows = new ArrayList<>();
            for (GenericRecord rec : stream) {
                List<Object> row = new ArrayList<>(fields.size());
                for (int i = 0; i < fields.size(); i++) {
                    row.add(convert(rec.get(i), fieldSchemas.get(i)));
                }
                rows.add(row);
            }
            return List.of(ReadResult.single(DataTable.of(columns, rows)));
        } catch (IOException | AvroRuntimeException | IllegalArgumentException e) {
            throw new IngestionException("Could not read avro data: " + e.getMessage(), e);
        }
    }

    // ["null", X] -> X; other unions stay as they are
    static Schema unwrapNullable(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) return schema;
        Schema single = null;
        for (Schema branch : schema.getTypes()) {
            if (branch.getType() == Schema.Type.NULL) continue;
            if (single != null) return schema;
            single = branch;
        }
        return single == null ? schema : single;
    }

    private static ColumnType columnType(Schema s) {
        LogicalType logical = s.getLogicalType();
        if (logical instanceof LogicalTypes.Date) return ColumnType.DATE;
        if (logical instanceof LogicalTypes.TimestampMillis || logical instanceof LogicalTypes.TimestampMicros) {
            return ColumnType.TIMESTAMP;
        }
        if (logical instanceof LogicalTypes.Decimal) return ColumnType.DOUBLE;
        return switch (s.getType()) {
            case BOOLEAN -> ColumnType.BOOLEAN;
            case INT, LONG -> ColumnType.BIGINT;
            case FLOAT, DOUBLE -> ColumnType.DOUBLE;
            case BYTES, FIXED -> ColumnType.BLOB;
            default -> ColumnType.VARCHAR;
        };
    }

    private static Object convert(Object value, Schema s) {
        if (value == null) return null;
        LogicalType logical = s.getLogicalType();
        if (logical instanceof LogicalTypes.Date) {
            return LocalDate.ofEpochDay(((Number) value).longValue());
        }
        if (logical instanceof LogicalTypes.TimestampMillis) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC);
        }
        if (logical instanceof LogicalTypes.TimestampMicros) {
            long micros = ((Number) value).longValue();
            Instant instant = Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1000L);
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (logical instanceof LogicalTypes.Decimal) {
            if (value instanceof ByteBuffer buf) return DECIMALS.fromBytes(buf.duplicate(), s, logical).doubleValue();
            if (value instanceof GenericFixed fixed) return DECIMALS.fromFixed(fixed, s, logical).doubleValue();
        }
        if (value instanceof GenericFixed fixed) return fixed.bytes();
        if (value instanceof ByteBuffer || value instanceof Number || value instanceof Boolean) return value;
        // strings (Utf8), enum symbols, records, arrays and maps
        return value.toString();
    }
}
