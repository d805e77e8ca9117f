package com.catalog.comparer.report;

import com.catalog.comparer.model.ReportLine;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test CSV report output
 */
class CsvReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Report is written with the fixed header and one row per key")
    void testWriteReport() throws IOException {
        Path output = tempDir.resolve("output/nested/diff_report.csv");
        List<ReportLine> lines = Arrays.asList(
                new ReportLine("A1", "base,eu", Arrays.asList("color [red → blue]", "additional_attributes:size [M → L]")),
                new ReportLine("Z9", "", Arrays.asList("extra_in_production")));

        new CsvReportWriter(output).write("sku", lines);

        assertTrue(Files.exists(output), "Parent directories should be created");
        List<String> written = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(3, written.size());
        assertEquals("sku,product_websites,differences", written.get(0));
        assertEquals("A1,\"base,eu\",color [red → blue]; additional_attributes:size [M → L]", written.get(1));
        assertEquals("Z9,,extra_in_production", written.get(2));
    }

    @Test
    @DisplayName("Header uses the configured key field name")
    void testCustomKeyField() throws IOException {
        Path output = tempDir.resolve("report.csv");

        new CsvReportWriter(output).write("ean", Arrays.asList(
                new ReportLine("123", "base", Arrays.asList("missing_in_production"))));

        List<String> written = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals("ean,product_websites,differences", written.get(0));
        assertEquals("123,base,missing_in_production", written.get(1));
    }
}
