package com.vedant.dataquery.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Column types a {@link DataTable} can hold, with their DuckDB type and canonical Java value class.
 */
public enum ColumnType {
    BOOLEAN("BOOLEAN"),
    BIGINT("BIGINT"),
    DOUBLE("DOUBLE"),
    DATE("DATE"),
    TIMESTAMP("TIMESTAMP"),
    VARCHAR("VARCHAR"),
    BLOB("BLOB");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }

    public boolean isNumeric() {
        return this == BIGINT || this == DOUBLE;
    }

    /**
     * Converts a value into this type's canonical Java representation
     * (Boolean, Long, Double, LocalDate, LocalDateTime, String, byte[]).
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    public Object coerce(Object value) {
        if (value == null) return null;
        return switch (this) {
            case BOOLEAN -> toBoolean(value);
            case BIGINT -> toLong(value);
            case DOUBLE -> toDouble(value);
            case DATE -> toDate(value);
            case TIMESTAMP -> toTimestamp(value);
            case VARCHAR -> toText(value);
            case BLOB -> toBytes(value);
        };
    }

    public static ColumnType fromJdbc(int jdbcType) {
        return switch (jdbcType) {
            case Types.BOOLEAN, Types.BIT -> BOOLEAN;
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> BIGINT;
            case Types.FLOAT, Types.REAL, Types.DOUBLE, Types.DECIMAL, Types.NUMERIC -> DOUBLE;
            case Types.DATE -> DATE;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> BLOB;
            default -> VARCHAR;
        };
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0d;
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        if (s.equals("true")) return Boolean.TRUE;
        if (s.equals("false")) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    private static Long toLong(Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bi) return bi.longValueExact();
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) return (long) d;
            throw new IllegalArgumentException("Not an integer: " + value);
        }
        String s = value.toString().trim();
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException ex) {
            return toLong(Double.parseDouble(s));
        }
    }

    private static Double toDouble(Object value) {
        if (value instanceof Double d) return d;
        if (value instanceof Number n) return n.doubleValue();
        return Double.parseDouble(value.toString().trim());
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof java.sql.Date d) return d.toLocalDate();
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof java.util.Date d) {
            return d.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }
        return LocalDate.parse(value.toString().trim());
    }

    private static LocalDateTime toTimestamp(Object value) {
        if (value instanceof LocalDateTime dt) return dt;
        if (value instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
        if (value instanceof LocalDate d) return d.atStartOfDay();
        if (value instanceof OffsetDateTime odt) return odt.toLocalDateTime();
        if (value instanceof java.util.Date d) {
            return LocalDateTime.ofInstant(d.toInstant(), ZoneId.systemDefault());
        }
        String s = value.toString().trim().replace(' ', 'T');
        return LocalDateTime.parse(s);
    }

    private static String toText(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof BigDecimal bd) return bd.toPlainString();
        if (value instanceof byte[] bytes) return new String(bytes, StandardCharsets.UTF_8);
        return value.toString();
    }

    private static byte[] toBytes(Object value) {
        if (value instanceof byte[] bytes) return bytes;
        if (value instanceof ByteBuffer buf) {
            ByteBuffer dup = buf.duplicate();
            byte[] out = new byte[dup.remaining()];
            dup.get(out);
            return out;
        }
        return value.toString().getBytes(StandardCharsets.UTF_8);
    }
}
