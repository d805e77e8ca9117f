package com.catalog.comparer.parser;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote-aware splitter for one delimited record.
 * <p>
 * Either {@code "} or {@code '} opens a quoted span; only the same character closes it.
 * Delimiters inside a quoted span do not separate fields. Quote markers are kept in the
 * returned fields, except for the free-text column which is unwrapped and protected by
 * {@link #protectFreeText(String, char, int)}.
 */
@Slf4j
public final class RowParser {

    /** Marks the free-text column as absent from the header */
    public static final int NO_FREE_TEXT = -1;

    private enum ScanState {
        OUTSIDE_QUOTES,
        INSIDE_QUOTES
    }

    private RowParser() {
    }

    /**
     * Split a record into raw fields, keeping quote characters in place
     */
    public static List<String> splitFields(String line, char delimiter) {
        if (line == null) {
            throw new IllegalArgumentException("line must not be null");
        }
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        ScanState state = ScanState.OUTSIDE_QUOTES;
        char openQuote = 0;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"' || ch == '\'') {
                if (state == ScanState.OUTSIDE_QUOTES) {
                    state = ScanState.INSIDE_QUOTES;
                    openQuote = ch;
                } else if (ch == openQuote) {
                    state = ScanState.OUTSIDE_QUOTES;
                }
                current.append(ch);
            } else if (ch == delimiter && state == ScanState.OUTSIDE_QUOTES) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /**
     * Rewrite a record so that its free-text field carries no delimiter, quote or line break.
     * The field loses one layer of surrounding quotes and its special characters are replaced
     * by placeholders; every other field is left byte-for-byte as it was.
     *
     * @param line one logical record
     * @param delimiter row delimiter
     * @param freeTextIndex index of the free-text column, or {@link #NO_FREE_TEXT}
     * @return the record re-joined with the delimiter
     */
    public static String protectFreeText(String line, char delimiter, int freeTextIndex) {
        List<String> parts = splitFields(line, delimiter);
        if (freeTextIndex >= 0 && freeTextIndex < parts.size()) {
            String value = unwrapQuotes(parts.get(freeTextIndex));
            parts.set(freeTextIndex, FreeTextPlaceholders.protect(value, delimiter));
        } else if (freeTextIndex >= 0) {
            log.debug("Record has {} fields, free-text column {} not present", parts.size(), freeTextIndex);
        }
        return String.join(String.valueOf(delimiter), parts);
    }

    /**
     * Strip one layer of matching surrounding quotes. A double-quoted value also has its
     * doubled {@code ""} escapes collapsed.
     */
    static String unwrapQuotes(String value) {
        if (value.length() < 2) {
            return value;
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if (first == '"' && last == '"') {
            return value.substring(1, value.length() - 1).replace("\"\"", "\"");
        }
        if (first == '\'' && last == '\'') {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
