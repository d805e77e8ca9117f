package com.catalog.comparer.parser;

/**
 * Placeholder tokens hiding the characters of the free-text column that would otherwise
 * confuse a one-line-per-record delimited parser.
 * <p>
 * Tokens are built from private-use code points, one per character class, so a restore
 * never turns ordinary catalog text into punctuation.
 */
public final class FreeTextPlaceholders {

    public static final String SECTION_MARKER = "\u00A7";

    static final String COMMA = "\uE000COMMA\uE001";
    static final String DELIMITER = "\uE000DELIM\uE001";
    static final String CARRIAGE_RETURN = "\uE000CR\uE001";
    static final String LINE_FEED = "\uE000LF\uE001";
    static final String SECTION = "\uE000SECTION\uE001";
    static final String QUOTE = "\uE000QUOTE\uE001";

    private FreeTextPlaceholders() {
    }

    /**
     * Replace every comma, row delimiter, CR, LF, section marker and double quote with its token
     */
    public static String protect(String value, char delimiter) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String result = value
                .replace(",", COMMA)
                .replace("\r", CARRIAGE_RETURN)
                .replace("\n", LINE_FEED)
                .replace(SECTION_MARKER, SECTION)
                .replace("\"", QUOTE);
        if (delimiter != ',') {
            result = result.replace(String.valueOf(delimiter), DELIMITER);
        }
        return result;
    }

    /**
     * Inverse of {@link #protect(String, char)}
     */
    public static String restore(String value, char delimiter) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String result = value;
        if (delimiter != ',') {
            result = result.replace(DELIMITER, String.valueOf(delimiter));
        }
        return result
                .replace(QUOTE, "\"")
                .replace(SECTION, SECTION_MARKER)
                .replace(LINE_FEED, "\n")
                .replace(CARRIAGE_RETURN, "\r")
                .replace(COMMA, ",");
    }
}
