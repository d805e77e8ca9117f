package com.catalog.comparer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * A loaded catalog: trimmed key to record, in first-seen key order.
 * Built once per run and immutable thereafter.
 */
@Getter
@ToString
public class CatalogModel {

    // Display name, usually the source file name
    private final String name;

    // Header columns in document order
    private final List<String> columns;

    // Key -> record
    private final Map<String, CatalogRecord> records;

    public CatalogModel(String name, List<String> columns, Map<String, CatalogRecord> records) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public static CatalogModel empty(String name) {
        return new CatalogModel(name, List.of(), Map.of());
    }

    /**
     * Get record by key
     */
    public CatalogRecord getRecord(String key) {
        return records.get(key);
    }

    public boolean containsKey(String key) {
        return records.containsKey(key);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
