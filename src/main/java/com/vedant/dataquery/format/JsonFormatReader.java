package com.vedant.dataquery.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.dataquery.exception.IngestionException;
import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON documents. An object root is one row, an array root is one row per element.
 * Nested objects are flattened into dotted column names ({@code address.city}).
 */
public class JsonFormatReader implements FormatReader {

    static final String SCALAR_COLUMN = "value";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public FileFormat format() {
        return FileFormat.JSON;
    }

    @Override
    public List<ReadResult> read(byte[] content, LoadOptions options) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new IngestionException("Invalid JSON: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new IngestionException("Empty JSON document");
        }

        List<Map<String, JsonNode>> records = new ArrayList<>();
        if (root.isObject()) {
            records.add(flatten(root));
        } else if (root.isArray()) {
            for (JsonNode element : root) {
                if (element.isObject()) {
                    records.add(flatten(element));
                } else {
                    Map<String, JsonNode> single = new LinkedHashMap<>();
                    single.put(SCALAR_COLUMN, element);
                    records.add(single);
                }
            }
        } else {
            throw new IngestionException("JSON root must be an object or an array, found " + root.getNodeType());
        }

        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, JsonNode> r : records) keys.addAll(r.keySet());

        List<Column> columns = new ArrayList<>(keys.size());
        for (String key : keys) {
            columns.add(new Column(key, columnType(records, key)));
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, JsonNode> r : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (Column c : columns) {
                row.add(value(r.get(c.name()), c.type()));
            }
            rows.add(row);
        }
        return List.of(ReadResult.single(DataTable.of(columns, rows)));
    }

    static Map<String, JsonNode> flatten(JsonNode object) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        flattenInto("", object, out);
        return out;
    }

    private static void flattenInto(String prefix, JsonNode object, Map<String, JsonNode> out) {
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = prefix + e.getKey();
            JsonNode v = e.getValue();
            if (v.isObject() && v.size() > 0) {
                flattenInto(key + ".", v, out);
            } else {
                out.put(key, v);
            }
        }
    }

    private static ColumnType columnType(List<Map<String, JsonNode>> records, String key) {
        boolean any = false;
        boolean allInt = true;
        boolean allNumber = true;
        boolean allBool = true;
        for (Map<String, JsonNode> r : records) {
            JsonNode v = r.get(key);
            if (v == null || v.isNull()) continue;
            any = true;
            if (!(v.isIntegralNumber() && v.canConvertToLong())) allInt = false;
            if (!v.isNumber()) allNumber = false;
            if (!v.isBoolean()) allBool = false;
        }
        if (!any) return ColumnType.VARCHAR;
        if (allInt) return ColumnType.BIGINT;
        if (allNumber) return ColumnType.DOUBLE;
        if (allBool) return ColumnType.BOOLEAN;
        return ColumnType.VARCHAR;
    }

    private static Object value(JsonNode v, ColumnType type) {
        if (v == null || v.isNull()) return null;
        return switch (type) {
            case BIGINT -> v.longValue();
            case DOUBLE -> v.doubleValue();
            case BOOLEAN -> v.booleanValue();
            default -> v.isValueNode() ? v.asText() : v.toString();
        };
    }
}
