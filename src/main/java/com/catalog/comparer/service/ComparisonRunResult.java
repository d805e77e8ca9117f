package com.catalog.comparer.service;

import com.catalog.comparer.model.ReportLine;
import com.catalog.comparer.model.comparison.CatalogComparison;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one comparison run
 */
@Data
public class ComparisonRunResult {

    private CatalogComparison comparison;

    /**
     * Grouped report lines, empty when the catalogs match
     */
    private List<ReportLine> reportLines = new ArrayList<>();

    /**
     * CSV report path, null when nothing was written
     */
    private Path reportFile;

    private Path excelFile;

    private Path jsonFile;

    private long executionTimeMs;

    public boolean hasDifferences() {
        return comparison != null && comparison.hasDifferences();
    }
}
