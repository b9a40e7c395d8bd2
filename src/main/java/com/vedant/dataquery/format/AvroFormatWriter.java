package com.vedant.dataquery.format;

import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Avro object container file with one record schema; every field is a union with null.
 * Column names that are not legal Avro names (count_star(), a.b, "total amount") get a
 * sanitized field name, and the column name is kept in the field's {@code column_name} property.
 */
public class AvroFormatWriter implements FormatWriter {

    static final String RECORD_NAME = "query_result";
    static final String COLUMN_NAME_PROP = "column_name";

    @Override
    public FileFormat format() {
        return FileFormat.AVRO;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        Schema schema = schemaFor(table);
        try (DataFileWriter<GenericRecord> writer = new DataFileWriter<>(new GenericDatumWriter<>(schema))) {
            writer.create(schema, out);
            for (List<Object> row : table.rows()) {
                GenericRecord rec = new GenericData.Record(schema);
                for (int c = 0; c < row.size(); c++) {
                    rec.put(c, toAvro(row.get(c)));
                }
                writer.append(rec);
            }
        }
    }

    static Schema schemaFor(DataTable table) {
        List<Schema.Field> fields = new ArrayList<>(table.columnCount());
        Set<String> used = new HashSet<>();
        for (Column c : table.columns()) {
            Schema value = switch (c.type()) {
                case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
                case BIGINT -> Schema.create(Schema.Type.LONG);
                case DOUBLE -> Schema.create(Schema.Type.DOUBLE);
                case DATE -> LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
                case TIMESTAMP -> LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
                case BLOB -> Schema.create(Schema.Type.BYTES);
                case VARCHAR -> Schema.create(Schema.Type.STRING);
            };
            Schema nullable = Schema.createUnion(Schema.create(Schema.Type.NULL), value);
            String fieldName = fieldName(c.name(), used);
            Schema.Field field = new Schema.Field(fieldName, nullable, null, Schema.Field.NULL_DEFAULT_VALUE);
            if (!fieldName.equals(c.name())) field.addProp(COLUMN_NAME_PROP, c.name());
            fields.add(field);
        }
        return Schema.createRecord(RECORD_NAME, null, null, false, fields);
    }

    // [A-Za-z_][A-Za-z0-9_]*, unique within the record
    static String fieldName(String column, Set<String> used) {
        StringBuilder sb = new StringBuilder(column.length() + 1);
        for (int i = 0; i < column.length(); i++) {
            char ch = column.charAt(i);
            boolean legal = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_'
                    || (i > 0 && ch >= '0' && ch <= '9');
            if (i == 0 && ch >= '0' && ch <= '9') sb.append('_').append(ch);
            else sb.append(legal ? ch : '_');
        }
        if (sb.length() == 0) sb.append('_');
        String base = sb.toString();
        String name = base;
        for (int n = 2; !used.add(name); n++) {
            name = base + "_" + n;
        }
        return name;
    }

    private static Object toAvro(Object v) {
        if (v instanceof LocalDate d) return (int) d.toEpochDay();
        if (v instanceof LocalDateTime ts) return ts.toInstant(ZoneOffset.UTC).toEpochMilli();
        if (v instanceof byte[] bytes) return ByteBuffer.wrap(bytes);
        return v;
    }
}
