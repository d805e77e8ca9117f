package com.catalog.comparer.model.comparison;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of comparing a staging catalog against a production catalog
 */
@Data
public class CatalogComparison {
    /**
     * Staging catalog name
     */
    private String stagingName;

    /**
     * Production catalog name
     */
    private String productionName;

    private int stagingRecords;

    private int productionRecords;

    /**
     * Diff entries in staging order, production-only keys last
     */
    private List<DiffEntry> entries = new ArrayList<>();

    public void addEntry(DiffEntry entry) {
        entries.add(entry);
    }

    public boolean hasDifferences() {
        return !entries.isEmpty();
    }

    /**
     * Get only entries of one kind
     */
    public List<DiffEntry> getEntriesOfType(DiffType type) {
        return entries.stream()
                .filter(entry -> entry.getType() == type)
                .collect(Collectors.toList());
    }

    /**
     * Get summary statistics
     */
    public ComparisonSummary getSummary() {
        ComparisonSummary summary = new ComparisonSummary();
        summary.setStagingRecords(stagingRecords);
        summary.setProductionRecords(productionRecords);
        summary.setMissingInProduction(getEntriesOfType(DiffType.MISSING_IN_PRODUCTION).size());
        summary.setExtraInProduction(getEntriesOfType(DiffType.EXTRA_IN_PRODUCTION).size());

        Set<String> divergent = new LinkedHashSet<>();
        int fieldDifferences = 0;
        for (DiffEntry entry : entries) {
            if (!entry.getType().isRecordLevel()) {
                divergent.add(entry.getKey());
                fieldDifferences++;
            }
        }
        summary.setRecordsWithDifferences(divergent.size());
        summary.setFieldDifferences(fieldDifferences);
        summary.setTotalDifferences(entries.size());

        int common = stagingRecords - summary.getMissingInProduction();
        summary.setCommonRecords(common);
        if (common > 0) {
            summary.setMatchPercentage(((common - divergent.size()) * 100.0) / common);
        } else {
            summary.setMatchPercentage(100.0);
        }
        return summary;
    }

    /**
     * Summary statistics for a catalog comparison
     */
    @Data
    public static class ComparisonSummary {
        private int stagingRecords;
        private int productionRecords;
        private int commonRecords;
        private int missingInProduction;
        private int extraInProduction;
        private int recordsWithDifferences;
        private int fieldDifferences;
        private int totalDifferences;
        private double matchPercentage;
    }
}
