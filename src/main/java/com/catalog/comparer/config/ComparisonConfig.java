package com.catalog.comparer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for a catalog comparison run.
 * Bound from JSON or YAML using snake_case keys.
 */
@Data
@Slf4j
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparisonConfig {

    public static final String DEFAULT_KEY_FIELD = "sku";
    public static final String DEFAULT_DELIMITER = ",";
    public static final String DEFAULT_ATTR_SEPARATOR = "§";
    public static final String DEFAULT_SPECIAL_FIELD = "additional_attributes";
    public static final String DEFAULT_OUTPUT_FILE = "output/diff_report.csv";

    /**
     * Column identifying a product in both catalogs
     */
    @JsonProperty("key_field")
    private String keyField = DEFAULT_KEY_FIELD;

    /**
     * Row delimiter of both input documents, a single character
     */
    @JsonProperty("csv_delimiter")
    private String csvDelimiter = DEFAULT_DELIMITER;

    /**
     * Separator between key=value pairs inside the free-text column
     */
    @JsonProperty("attr_separator")
    private String attrSeparator = DEFAULT_ATTR_SEPARATOR;

    /**
     * Columns skipped entirely during comparison
     */
    @JsonProperty("exclude_columns")
    private Set<String> excludeColumns = new LinkedHashSet<>();

    /**
     * Sub-attribute keys skipped inside the free-text column
     */
    @JsonProperty("exclude_additional_attributes")
    private Set<String> excludeAdditionalAttributes = new LinkedHashSet<>();

    /**
     * Columns (or "column:subkey" fields) whose values are HTML-escaped in the report
     */
    @JsonProperty("html_fields")
    private Set<String> htmlFields = new LinkedHashSet<>();

    /**
     * Free-text column that may contain the delimiter and line breaks
     */
    @JsonProperty("special_field")
    private String specialField = DEFAULT_SPECIAL_FIELD;

    @JsonProperty("output_file")
    private String outputFile = DEFAULT_OUTPUT_FILE;

    /**
     * Staging catalog location
     */
    @JsonProperty("master_file")
    private String masterFile;

    /**
     * Production catalog location
     */
    @JsonProperty("comparison_file")
    private String comparisonFile;

    /**
     * Optional Excel rendition of the report
     */
    @JsonProperty("excel_output")
    private String excelOutput;

    /**
     * Optional JSON export of the raw diff entries
     */
    @JsonProperty("json_output")
    private String jsonOutput;

    /**
     * Delimiter as a character; only valid after {@link #validate()}
     */
    public char delimiterChar() {
        return csvDelimiter.charAt(0);
    }

    /**
     * Check that the configuration can drive a run
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() throws IllegalArgumentException {
        if (masterFile == null || masterFile.isBlank()) {
            throw new IllegalArgumentException("master_file is required");
        }
        if (comparisonFile == null || comparisonFile.isBlank()) {
            throw new IllegalArgumentException("comparison_file is required");
        }
        if (csvDelimiter == null || csvDelimiter.length() != 1) {
            throw new IllegalArgumentException("csv_delimiter must be exactly one character, got: " + csvDelimiter);
        }
        if ("\"'\r\n".indexOf(csvDelimiter.charAt(0)) >= 0) {
            throw new IllegalArgumentException("csv_delimiter cannot be a quote character or a line break");
        }
        if (attrSeparator == null || attrSeparator.isEmpty()) {
            throw new IllegalArgumentException("attr_separator must not be empty");
        }
        if (keyField == null || keyField.isEmpty()) {
            throw new IllegalArgumentException("key_field must not be empty");
        }
        if (specialField == null || specialField.isEmpty()) {
            throw new IllegalArgumentException("special_field must not be empty");
        }
        if (outputFile == null || outputFile.isBlank()) {
            log.debug("output_file not set, falling back to {}", DEFAULT_OUTPUT_FILE);
            outputFile = DEFAULT_OUTPUT_FILE;
        }
        if (excludeColumns == null) {
            excludeColumns = new LinkedHashSet<>();
        }
        if (excludeAdditionalAttributes == null) {
            excludeAdditionalAttributes = new LinkedHashSet<>();
        }
        if (htmlFields == null) {
            htmlFields = new LinkedHashSet<>();
        }
    }
}
