package com.catalog.comparer.service;

import com.catalog.comparer.config.ComparisonConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of a comparison run over files
 */
class CatalogComparisonServiceTest {

    private static final String HEADER = "sku,name,product_websites,additional_attributes\n";

    @TempDir
    Path tempDir;

    private CatalogComparisonService service;

    @BeforeEach
    void setUp() {
        service = new CatalogComparisonService();
    }

    @Test
    @DisplayName("Differences are written to the CSV report")
    void testRunWithDifferences() throws IOException {
        ComparisonConfig config = config(
                HEADER
                        + "A1,Shirt,\"base,eu\",\"size=M§note=hello, world\"\n"
                        + "B2,Hat,base,\n",
                HEADER
                        + "A1,Shirt,\"base,eu\",\"size=L§note=hello, world\"\n"
                        + "Z9,Sock,base,\n");

        ComparisonRunResult result = service.run(config);

        assertTrue(result.hasDifferences());
        assertEquals(3, result.getComparison().getEntries().size());
        assertEquals(3, result.getReportLines().size());
        assertNotNull(result.getReportFile());

        List<String> report = Files.readAllLines(result.getReportFile(), StandardCharsets.UTF_8);
        assertEquals("sku,product_websites,differences", report.get(0));
        assertEquals("A1,\"base,eu\",additional_attributes:size [M → L]", report.get(1));
        assertEquals("B2,base,missing_in_production", report.get(2));
        assertEquals("Z9,,extra_in_production", report.get(3));
    }

    @Test
    @DisplayName("Identical catalogs produce no report file")
    void testRunWithoutDifferences() throws IOException {
        String catalog = HEADER + "A1,Shirt,base,\"size=M§line one\nline two\"\n";
        ComparisonConfig config = config(catalog, catalog);

        ComparisonRunResult result = service.run(config);

        assertFalse(result.hasDifferences());
        assertTrue(result.getReportLines().isEmpty());
        assertNull(result.getReportFile());
        assertFalse(Files.exists(tempDir.resolve("output/diff_report.csv")));
    }

    @Test
    @DisplayName("Excel and JSON exports are produced on request")
    void testOptionalExports() throws IOException {
        ComparisonConfig config = config(
                HEADER + "A1,Shirt,base,size=M\n",
                HEADER + "A1,Shirt Deluxe,base,size=M\n");
        config.setExcelOutput(tempDir.resolve("output/report.xlsx").toString());
        config.setJsonOutput(tempDir.resolve("output/report.json").toString());

        ComparisonRunResult result = service.run(config);

        assertNotNull(result.getExcelFile());
        try (InputStream in = Files.newInputStream(result.getExcelFile());
             Workbook workbook = new XSSFWorkbook(in)) {
            Sheet summary = workbook.getSheet("Summary");
            assertEquals("A1", summary.getRow(1).getCell(1).getStringCellValue());
            assertEquals("name [Shirt → Shirt Deluxe]", summary.getRow(1).getCell(3).getStringCellValue());
            Sheet details = workbook.getSheet("Details");
            assertEquals("different_value", details.getRow(1).getCell(2).getStringCellValue());
        }

        assertNotNull(result.getJsonFile());
        JsonNode json = new ObjectMapper().readTree(result.getJsonFile().toFile());
        assertEquals(1, json.get("entries").size());
        assertEquals("name", json.get("entries").get(0).get("field").asText());
        assertEquals(1, json.get("summary").get("fieldDifferences").asInt());
    }

    @Test
    @DisplayName("Missing input is an error")
    void testMissingInput() throws IOException {
        ComparisonConfig config = config(HEADER, HEADER);
        config.setComparisonFile(tempDir.resolve("absent.csv").toString());

        assertThrows(IOException.class, () -> service.run(config));
    }

    private ComparisonConfig config(String stagingContent, String productionContent) throws IOException {
        Path staging = tempDir.resolve("staging.csv");
        Path production = tempDir.resolve("production.csv");
        Files.write(staging, stagingContent.getBytes(StandardCharsets.UTF_8));
        Files.write(production, productionContent.getBytes(StandardCharsets.UTF_8));

        ComparisonConfig config = new ComparisonConfig();
        config.setMasterFile(staging.toString());
        config.setComparisonFile(production.toString());
        config.setOutputFile(tempDir.resolve("output/diff_report.csv").toString());
        config.validate();
        return config;
    }
}
