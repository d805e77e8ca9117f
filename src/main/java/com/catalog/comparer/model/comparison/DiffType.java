package com.catalog.comparer.model.comparison;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of divergence between staging and production
 */
public enum DiffType {
    /**
     * Record exists only in staging
     */
    MISSING_IN_PRODUCTION("missing_in_production"),

    /**
     * Record exists only in production
     */
    EXTRA_IN_PRODUCTION("extra_in_production"),

    /**
     * A plain column differs
     */
    DIFFERENT_VALUE("different_value"),

    /**
     * A sub-attribute of the free-text column differs
     */
    DIFFERENT_ATTRIBUTE("different_value (additional_attribute)");

    private final String label;

    DiffType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Whether the entry concerns a whole record rather than a field
     */
    public boolean isRecordLevel() {
        return this == MISSING_IN_PRODUCTION || this == EXTRA_IN_PRODUCTION;
    }
}
