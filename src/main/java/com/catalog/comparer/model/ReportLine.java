package com.catalog.comparer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grouped report row: every rendered difference of one record key
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReportLine {

    public static final String DIFFERENCE_SEPARATOR = "; ";

    private String key;

    // Auxiliary display value from the staging record, "" when the key is not in staging
    private String productWebsites = "";

    // Rendered descriptions in diff order
    private List<String> differences = new ArrayList<>();

    public ReportLine(String key) {
        this.key = key;
    }

    public void addDifference(String description) {
        differences.add(description);
    }

    /**
     * All descriptions joined the way the report column shows them
     */
    public String getJoinedDifferences() {
        return String.join(DIFFERENCE_SEPARATOR, differences);
    }
}
