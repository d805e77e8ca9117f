package com.catalog.comparer.service;

import com.catalog.comparer.model.comparison.CatalogComparison;
import com.catalog.comparer.model.comparison.DiffEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Exports comparison results to JSON format
 */
@Slf4j
public class JsonResultExporter {

    private final ObjectMapper objectMapper;

    public JsonResultExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Export a comparison to a JSON file
     *
     * @param comparison comparison result
     * @param outputFile output file path, parent directories are created
     */
    public void exportToJson(CatalogComparison comparison, Path outputFile) throws IOException {
        log.info("Exporting comparison results to JSON: {}", outputFile.toAbsolutePath());

        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ComparisonResultJson result = ComparisonResultJson.builder()
                .generatedAt(Instant.now())
                .staging(comparison.getStagingName())
                .production(comparison.getProductionName())
                .summary(comparison.getSummary())
                .entries(comparison.getEntries())
                .build();

        objectMapper.writeValue(outputFile.toFile(), result);

        log.info("Successfully exported JSON results: {} diff entries", comparison.getEntries().size());
    }

    /**
     * Serialized shape of an exported comparison
     */
    @Data
    @Builder
    public static class ComparisonResultJson {
        private Instant generatedAt;
        private String staging;
        private String production;
        private CatalogComparison.ComparisonSummary summary;
        private List<DiffEntry> entries;
    }
}
