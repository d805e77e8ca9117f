package com.catalog.comparer.model.comparison;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One detected divergence, scoped to a whole record or a single field/sub-field
 */
@Value
@Builder
@AllArgsConstructor
public class DiffEntry {
    /**
     * Key of the affected record
     */
    String key;

    DiffType type;

    /**
     * Empty for record-level entries, "column" or "column:subkey" otherwise
     */
    String field;

    String stagingValue;

    String productionValue;

    public static DiffEntry missingInProduction(String key) {
        return new DiffEntry(key, DiffType.MISSING_IN_PRODUCTION, "", "", "");
    }

    public static DiffEntry extraInProduction(String key) {
        return new DiffEntry(key, DiffType.EXTRA_IN_PRODUCTION, "", "", "");
    }

    public static DiffEntry differentValue(String key, String field, String stagingValue, String productionValue) {
        return new DiffEntry(key, DiffType.DIFFERENT_VALUE, field, stagingValue, productionValue);
    }

    public static DiffEntry differentAttribute(String key, String column, String subKey,
                                               String stagingValue, String productionValue) {
        return new DiffEntry(key, DiffType.DIFFERENT_ATTRIBUTE, column + ":" + subKey, stagingValue, productionValue);
    }
}
