package com.catalog.comparer.model.comparison;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test comparison result helpers
 */
class CatalogComparisonTest {

    @Test
    @DisplayName("Entries can be filtered by kind")
    void testEntriesOfType() {
        CatalogComparison comparison = new CatalogComparison();
        comparison.addEntry(DiffEntry.differentValue("B2", "color", "red", "blue"));
        comparison.addEntry(DiffEntry.missingInProduction("C3"));
        comparison.addEntry(DiffEntry.differentAttribute("B2", "additional_attributes", "size", "M", "L"));

        List<DiffEntry> attributes = comparison.getEntriesOfType(DiffType.DIFFERENT_ATTRIBUTE);

        assertEquals(1, attributes.size());
        assertEquals("B2", attributes.get(0).getKey());
        assertEquals(1, comparison.getEntriesOfType(DiffType.MISSING_IN_PRODUCTION).size());
        assertTrue(comparison.getEntriesOfType(DiffType.EXTRA_IN_PRODUCTION).isEmpty());
    }

    @Test
    @DisplayName("Empty comparison of empty catalogs is a full match")
    void testEmptySummary() {
        CatalogComparison comparison = new CatalogComparison();

        CatalogComparison.ComparisonSummary summary = comparison.getSummary();

        assertFalse(comparison.hasDifferences());
        assertEquals(0, summary.getTotalDifferences());
        assertEquals(100.0, summary.getMatchPercentage(), 0.001);
    }

    @Test
    @DisplayName("Diff kinds serialize to their report labels")
    void testTypeLabels() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"missing_in_production\"", mapper.writeValueAsString(DiffType.MISSING_IN_PRODUCTION));
        assertEquals("\"different_value (additional_attribute)\"",
                mapper.writeValueAsString(DiffType.DIFFERENT_ATTRIBUTE));
        assertTrue(DiffType.EXTRA_IN_PRODUCTION.isRecordLevel());
        assertFalse(DiffType.DIFFERENT_VALUE.isRecordLevel());
        assertEquals("additional_attributes:size",
                DiffEntry.differentAttribute("A1", "additional_attributes", "size", "M", "L").getField());
    }
}
