package com.vedant.dataquery.util;

import com.vedant.dataquery.model.ColumnType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Infers a column type from the text values of a column: BIGINT, DOUBLE, BOOLEAN, TIMESTAMP,
 * DATE, otherwise VARCHAR. Blank values are ignored; an all-blank column is VARCHAR. Date-shaped
 * text that is not a real calendar date (2023-02-30) keeps the column VARCHAR.
 */
public final class TypeInference {

    private static final Pattern INT = Pattern.compile("^[-+]?\\d{1,18}$");
    private static final Pattern DOUBLE = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern BOOL = Pattern.compile("^(?i)(true|false)$");
    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TIMESTAMP = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?$");

    private TypeInference() {}

    public static ColumnType infer(Collection<String> samples) {
        boolean anyNonEmpty = false;
        boolean allInt = true;
        boolean allDouble = true;
        boolean allBool = true;
        boolean allDate = true;
        boolean allTimestamp = true;

        for (String s : samples) {
            if (s == null || s.isBlank()) continue;
            anyNonEmpty = true;
            String v = s.trim();
            if (allInt && !INT.matcher(v).matches()) allInt = false;
            if (allDouble && !DOUBLE.matcher(v).matches()) allDouble = false;
            if (allBool && !BOOL.matcher(v).matches()) allBool = false;
            if (allDate && !isDate(v)) allDate = false;
            if (allTimestamp && !isTimestamp(v)) allTimestamp = false;
            if (!allInt && !allDouble && !allBool && !allDate && !allTimestamp) break;
        }

        if (!anyNonEmpty) return ColumnType.VARCHAR;
        if (allInt) return ColumnType.BIGINT;
        if (allDouble) return ColumnType.DOUBLE;
        if (allBool) return ColumnType.BOOLEAN;
        if (allTimestamp) return ColumnType.TIMESTAMP;
        if (allDate) return ColumnType.DATE;
        return ColumnType.VARCHAR;
    }

    private static boolean isDate(String v) {
        if (!DATE.matcher(v).matches()) return false;
        try {
            LocalDate.parse(v);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    private static boolean isTimestamp(String v) {
        if (!TIMESTAMP.matcher(v).matches()) return false;
        try {
            LocalDateTime.parse(v.replace(' ', 'T'));
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    /** Maps blank text to null and keeps everything else as is for the column type to coerce. */
    public static Object cell(String raw, ColumnType type) {
        if (raw == null) return null;
        if (type == ColumnType.VARCHAR) return raw.isEmpty() ? null : raw;
        return raw.isBlank() ? null : raw.trim();
    }
}
