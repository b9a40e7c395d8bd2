package com.vedant.dataquery.format;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Text rendering of cell values for the text based export formats.
 */
final class ValueText {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueText() {}

    static String of(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return d.toString();
            String plain = BigDecimal.valueOf(d).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        if (value instanceof LocalDateTime ts) {
            String text = ts.format(TIMESTAMP);
            if (ts.getNano() == 0) return text;
            String nanos = String.format("%09d", ts.getNano()).replaceAll("0+$", "");
            return text + "." + nanos;
        }
        if (value instanceof byte[] bytes) return Base64.getEncoder().encodeToString(bytes);
        return value.toString();
    }
}
