package com.catalog.comparer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One catalog row: column name to field value, in header order.
 * Immutable once loaded.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CatalogRecord {

    // Trimmed value of the key column
    private final String key;

    // Column name -> raw field value (never null, possibly empty)
    private final Map<String, String> fields;

    public CatalogRecord(String key, Map<String, String> fields) {
        this.key = key;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Get a field value, or null if the column is absent from this record
     */
    public String get(String column) {
        return fields.get(column);
    }

    /**
     * Get a field value, treating an absent column as the empty string
     */
    public String getOrEmpty(String column) {
        String value = fields.get(column);
        return value != null ? value : "";
    }
}
