package com.vedant.dataquery.util;

import com.vedant.dataquery.model.UnitLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns file, archive and sheet names into lower case SQL identifiers.
 * The result never starts or ends with a digit.
 */
public final class NameSanitizer {

    private static final Pattern NOT_IDENTIFIER = Pattern.compile("[^a-z0-9_]");

    private NameSanitizer() {}

    public static String sanitize(String raw) {
        if (raw == null) return "";
        String name = raw.replace(" ", "").toLowerCase(Locale.ROOT);
        name = NOT_IDENTIFIER.matcher(name).replaceAll("");
        if (name.isEmpty()) return name;
        if (Character.isDigit(name.charAt(0))) name = "_" + name;
        if (Character.isDigit(name.charAt(name.length() - 1))) name = name + "_";
        return name;
    }

    /**
     * Table name for a unit: archive, file and sheet labels sanitized one by one (dots turned
     * into underscores first) and joined with underscores.
     */
    public static String tableName(UnitLabel label, String sheetName) {
        List<String> parts = new ArrayList<>(3);
        if (label.inArchive()) parts.add(part(label.archiveName()));
        parts.add(part(label.fileName()));
        if (sheetName != null) parts.add(part(sheetName));
        parts.removeIf(String::isEmpty);
        return sanitize(String.join("_", parts));
    }

    private static String part(String label) {
        return sanitize(label.replace('.', '_'));
    }
}
