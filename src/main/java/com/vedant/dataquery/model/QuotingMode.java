package com.vedant.dataquery.model;

import java.util.Locale;

public enum QuotingMode {
    ALL,
    MINIMAL,
    NONNUMERIC,
    NONE;

    /** Accepts both "MINIMAL" and "QUOTE_MINIMAL" spellings, case-insensitive. */
    public static QuotingMode parse(String value) {
        if (value == null || value.isBlank()) return MINIMAL;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("QUOTE_")) v = v.substring("QUOTE_".length());
        try {
            return valueOf(v);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown quoting option: " + value);
        }
    }
}
