package com.vedant.dataquery.format;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Array of row objects keyed by column name. Dates and timestamps are ISO-8601 strings.
 */
public class JsonFormatWriter implements FormatWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public FileFormat format() {
        return FileFormat.JSON;
    }

    @Override
    public void write(DataTable table, ExportOptions options, OutputStream out) throws IOException {
        List<String> names = table.columnNames();
        try (JsonGenerator gen = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            gen.writeStartArray();
            for (List<Object> row : table.rows()) {
                gen.writeStartObject();
                for (int c = 0; c < names.size(); c++) {
                    gen.writeFieldName(names.get(c));
                    writeValue(gen, row.get(c));
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
    }

    private static void writeValue(JsonGenerator gen, Object v) throws IOException {
        if (v == null) {
            gen.writeNull();
        } else if (v instanceof Long l) {
            gen.writeNumber(l);
        } else if (v instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) gen.writeNull();
            else gen.writeNumber(d);
        } else if (v instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (v instanceof byte[] bytes) {
            gen.writeBinary(bytes);
        } else {
            gen.writeString(v.toString());
        }
    }
}
