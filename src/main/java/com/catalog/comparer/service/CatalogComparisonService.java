package com.catalog.comparer.service;

import com.catalog.comparer.comparison.CatalogComparator;
import com.catalog.comparer.config.ComparisonConfig;
import com.catalog.comparer.model.CatalogModel;
import com.catalog.comparer.model.ReportLine;
import com.catalog.comparer.model.comparison.CatalogComparison;
import com.catalog.comparer.parser.CatalogLoader;
import com.catalog.comparer.report.CsvReportWriter;
import com.catalog.comparer.report.DiffReportBuilder;
import com.catalog.comparer.report.ExcelReportGenerator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs a full comparison: load both catalogs, diff them, write the reports
 */
@Slf4j
public class CatalogComparisonService {

    private final JsonResultExporter jsonExporter;

    public CatalogComparisonService() {
        this(new JsonResultExporter());
    }

    public CatalogComparisonService(JsonResultExporter jsonExporter) {
        this.jsonExporter = jsonExporter;
    }

    /**
     * Execute a comparison run
     *
     * @param config validated configuration
     * @return run outcome; no report file is written when the catalogs match
     * @throws IOException if an input cannot be read or a report cannot be written
     */
    public ComparisonRunResult run(ComparisonConfig config) throws IOException {
        long startTime = System.currentTimeMillis();
        log.info("Starting catalog comparison: {} vs {}", config.getMasterFile(), config.getComparisonFile());

        CatalogLoader loader = CatalogLoader.fromConfig(config);
        CatalogModel staging = loader.load(Paths.get(config.getMasterFile()));
        CatalogModel production = loader.load(Paths.get(config.getComparisonFile()));

        CatalogComparison comparison = CatalogComparator.compare(staging, production, config);

        ComparisonRunResult result = new ComparisonRunResult();
        result.setComparison(comparison);

        DiffReportBuilder reportBuilder = new DiffReportBuilder(config.getHtmlFields());
        Path reportFile = Paths.get(config.getOutputFile());
        List<ReportLine> lines = reportBuilder.write(comparison.getEntries(), staging, config.getKeyField(),
                new CsvReportWriter(reportFile));
        result.setReportLines(lines);

        if (!lines.isEmpty()) {
            result.setReportFile(reportFile);

            if (config.getExcelOutput() != null && !config.getExcelOutput().isBlank()) {
                Path excelFile = Paths.get(config.getExcelOutput());
                new ExcelReportGenerator(excelFile, comparison).write(config.getKeyField(), lines);
                result.setExcelFile(excelFile);
            }
        }

        if (config.getJsonOutput() != null && !config.getJsonOutput().isBlank()) {
            Path jsonFile = Paths.get(config.getJsonOutput());
            jsonExporter.exportToJson(comparison, jsonFile);
            result.setJsonFile(jsonFile);
        }

        result.setExecutionTimeMs(System.currentTimeMillis() - startTime);
        log.info("Catalog comparison finished in {} ms: {} diff entries over {} keys",
                result.getExecutionTimeMs(), comparison.getEntries().size(), lines.size());
        return result;
    }
}
