package com.catalog.comparer.report;

import com.catalog.comparer.model.ReportLine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the grouped report as a comma-separated file:
 * key, product_websites, differences
 */
@Slf4j
public class CsvReportWriter implements ReportSink {

    private final Path outputPath;

    public CsvReportWriter(Path outputPath) {
        this.outputPath = outputPath;
    }

    @Override
    public void write(String keyField, List<ReportLine> lines) throws IOException {
        log.info("Generating CSV report to: {}", outputPath);

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(out, keyField, lines);
        }
        log.info("CSV report generated successfully: {} rows", lines.size());
    }

    /**
     * Write the report to an already open writer
     */
    public static void write(Writer out, String keyField, List<ReportLine> lines) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(keyField, DiffReportBuilder.PRODUCT_WEBSITES, DiffReportBuilder.DIFFERENCES)
                .build();
        CSVPrinter printer = new CSVPrinter(out, format);
        for (ReportLine line : lines) {
            printer.printRecord(line.getKey(), line.getProductWebsites(), line.getJoinedDifferences());
        }
        printer.flush();
    }
}
