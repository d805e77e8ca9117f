package com.catalog.comparer;

import com.catalog.comparer.cli.CommandLineInterface;
import lombok.extern.slf4j.Slf4j;

/**
 * Main application entry point for Catalog Comparer
 * Audits a production product catalog against its staging source
 */
@Slf4j
public class CatalogComparerApplication {

    public static void main(String[] args) {
        try {
            CommandLineInterface cli = new CommandLineInterface();
            cli.execute(args);
        } catch (Exception e) {
            log.error("Error executing Catalog Comparer", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
