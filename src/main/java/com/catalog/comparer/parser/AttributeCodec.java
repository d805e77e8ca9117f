package com.catalog.comparer.parser;

import org.apache.commons.text.StringEscapeUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decodes the compound "additional attributes" value into sub-key/sub-value pairs.
 * <p>
 * Pairs are separated by the configured separator; each pair is split on its first
 * {@code =}. A pair without {@code =} is a flag whose value is the empty string.
 */
public final class AttributeCodec {

    private AttributeCodec() {
    }

    /**
     * Decode an attribute string
     *
     * @param value decoded free-text field value, may be null
     * @param separator pair separator, not empty
     * @return sub-key to sub-value in first-seen order; later duplicates overwrite earlier ones
     */
    public static Map<String, String> decode(String value, String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        if (value == null || value.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        for (String pair : value.split(Pattern.quote(separator), -1)) {
            int eq = pair.indexOf('=');
            if (eq >= 0) {
                String subKey = pair.substring(0, eq).trim();
                String subValue = StringEscapeUtils.unescapeHtml4(pair.substring(eq + 1).trim());
                attributes.put(subKey, unquote(subValue));
            } else if (!pair.trim().isEmpty()) {
                attributes.put(pair.trim(), "");
            }
        }
        return attributes;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
