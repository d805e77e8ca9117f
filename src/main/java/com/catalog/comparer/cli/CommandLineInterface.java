package com.catalog.comparer.cli;

import com.catalog.comparer.config.ComparisonConfig;
import com.catalog.comparer.config.ConfigLoader;
import com.catalog.comparer.model.comparison.CatalogComparison;
import com.catalog.comparer.model.comparison.DiffEntry;
import com.catalog.comparer.service.CatalogComparisonService;
import com.catalog.comparer.service.ComparisonRunResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;

import java.io.PrintStream;

/**
 * Command Line Interface handler for Catalog Comparer
 *
 * Usage:
 *   java -jar catalog-comparer.jar [-f config.json] [-s staging.csv] [-p production.csv] [-o report.csv]
 */
@Slf4j
public class CommandLineInterface {

    private final Options options;
    private final ConfigLoader configLoader;
    private final CatalogComparisonService comparisonService;
    private final PrintStream out;

    public CommandLineInterface() {
        this(new ConfigLoader(), new CatalogComparisonService(), System.out);
    }

    public CommandLineInterface(ConfigLoader configLoader, CatalogComparisonService comparisonService, PrintStream out) {
        this.options = initializeOptions();
        this.configLoader = configLoader;
        this.comparisonService = comparisonService;
        this.out = out;
    }

    private Options initializeOptions() {
        Options opts = new Options();

        opts.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Display help information")
                .build());

        opts.addOption(Option.builder("f")
                .longOpt("config")
                .hasArg()
                .argName("config-file")
                .desc("Path to the JSON or YAML configuration file (default: ./config.json)")
                .build());

        opts.addOption(Option.builder("s")
                .longOpt("staging")
                .hasArg()
                .argName("staging-file")
                .desc("Staging catalog, overrides master_file")
                .build());

        opts.addOption(Option.builder("p")
                .longOpt("production")
                .hasArg()
                .argName("production-file")
                .desc("Production catalog, overrides comparison_file")
                .build());

        opts.addOption(Option.builder("o")
                .longOpt("output")
                .hasArg()
                .argName("report-file")
                .desc("CSV report path, overrides output_file")
                .build());

        opts.addOption(Option.builder("x")
                .longOpt("excel")
                .hasArg()
                .argName("excel-file")
                .desc("Also export the report to an Excel file (e.g., report.xlsx)")
                .build());

        opts.addOption(Option.builder("j")
                .longOpt("json")
                .hasArg()
                .argName("json-file")
                .desc("Also export every diff entry to a JSON file")
                .build());

        opts.addOption(Option.builder("v")
                .longOpt("verbose")
                .desc("Print every diff entry")
                .build());

        return opts;
    }

    /**
     * Parse arguments and run a comparison
     *
     * @return the run outcome, or null when only help was requested
     */
    public ComparisonRunResult execute(String[] args) throws Exception {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);

        if (cmd.hasOption("h")) {
            printHelp();
            return null;
        }

        ComparisonConfig config = configLoader.read(cmd.getOptionValue("f"));
        if (cmd.hasOption("s")) {
            config.setMasterFile(cmd.getOptionValue("s"));
        }
        if (cmd.hasOption("p")) {
            config.setComparisonFile(cmd.getOptionValue("p"));
        }
        if (cmd.hasOption("o")) {
            config.setOutputFile(cmd.getOptionValue("o"));
        }
        if (cmd.hasOption("x")) {
            config.setExcelOutput(cmd.getOptionValue("x"));
        }
        if (cmd.hasOption("j")) {
            config.setJsonOutput(cmd.getOptionValue("j"));
        }
        configLoader.validated(config, cmd.getOptionValue("f"));

        boolean verbose = cmd.hasOption("v");

        out.println("╔══════════════════════════════════════════════════════════════════╗");
        out.println("║       Catalog Comparer - Staging vs Production                   ║");
        out.println("╚══════════════════════════════════════════════════════════════════╝");
        out.println();
        out.println("📂 Staging:    " + config.getMasterFile());
        out.println("📂 Production: " + config.getComparisonFile());
        out.println();

        ComparisonRunResult result = comparisonService.run(config);
        printResult(result, verbose);
        return result;
    }

    private void printResult(ComparisonRunResult result, boolean verbose) {
        CatalogComparison comparison = result.getComparison();
        CatalogComparison.ComparisonSummary summary = comparison.getSummary();

        out.printf("┌─ Records: %d staging vs %d production%n",
                summary.getStagingRecords(), summary.getProductionRecords());
        out.printf("│  Missing in production: %d, extra in production: %d, common: %d%n",
                summary.getMissingInProduction(), summary.getExtraInProduction(), summary.getCommonRecords());
        out.printf("│  Match Rate: %.1f%% (%d records with field differences)%n",
                summary.getMatchPercentage(), summary.getRecordsWithDifferences());

        if (verbose && comparison.hasDifferences()) {
            out.println("│");
            out.println("│  📋 Detailed Differences:");
            for (DiffEntry entry : comparison.getEntries()) {
                if (entry.getType().isRecordLevel()) {
                    out.printf("│       • %s: %s%n", entry.getKey(), entry.getType().getLabel());
                } else {
                    out.printf("│       • %s: %s [%s] ≠ [%s]%n", entry.getKey(), entry.getField(),
                            entry.getStagingValue(), entry.getProductionValue());
                }
            }
        }
        out.println("└─────────────────────────────────────────────────────────────────");
        out.println();

        if (!comparison.hasDifferences()) {
            out.println("✅ No differences found between the two catalogs.");
        } else {
            out.println("📄 Report generated: " + result.getReportFile());
            if (result.getExcelFile() != null) {
                out.println("📄 Excel report generated: " + result.getExcelFile());
            }
            out.println("Total differences found: " + comparison.getEntries().size());
        }
        if (result.getJsonFile() != null) {
            out.println("📄 JSON export generated: " + result.getJsonFile());
        }
    }

    private void printHelp() {
        out.println("Catalog Comparer - Staging vs Production Catalog Audit Tool");
        out.println();
        out.println("USAGE:");
        out.println("  java -jar catalog-comparer.jar [OPTIONS]");
        out.println();
        out.println("OPTIONS:");
        out.println("  -h, --help              Display this help message");
        out.println("  -f, --config FILE       Path to configuration file (JSON or YAML)");
        out.println("                          (default: ./config.json)");
        out.println("  -s, --staging FILE      Staging catalog (overrides master_file)");
        out.println("  -p, --production FILE   Production catalog (overrides comparison_file)");
        out.println("  -o, --output FILE       CSV report path (overrides output_file)");
        out.println("  -x, --excel FILE        Also export the report to an Excel file");
        out.println("  -j, --json FILE         Also export every diff entry to JSON");
        out.println("  -v, --verbose           Print every diff entry");
        out.println();
        out.println("EXAMPLES:");
        out.println("  # Compare using ./config.json");
        out.println("  java -jar catalog-comparer.jar");
        out.println();
        out.println("  # Compare two exports with an explicit config and Excel output");
        out.println("  java -jar catalog-comparer.jar -f audit.yaml -s staging.csv -p production.csv -x report.xlsx");
        out.println();
    }
}
