package com.catalog.comparer.report;

import com.catalog.comparer.model.CatalogModel;
import com.catalog.comparer.model.CatalogRecord;
import com.catalog.comparer.model.ReportLine;
import com.catalog.comparer.model.comparison.DiffEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.translate.AggregateTranslator;
import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.EntityArrays;
import org.apache.commons.text.translate.LookupTranslator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups diff entries per key and renders them as human-readable descriptions
 */
@Slf4j
public class DiffReportBuilder {

    public static final String PRODUCT_WEBSITES = "product_websites";
    public static final String DIFFERENCES = "differences";

    static final String ARROW = " → ";

    // & < > " and ' only, every other character passes through
    private static final CharSequenceTranslator ESCAPE_MARKUP = new AggregateTranslator(
            new LookupTranslator(EntityArrays.BASIC_ESCAPE),
            new LookupTranslator(Map.<CharSequence, CharSequence>of("'", "&#x27;")));

    private final Set<String> htmlFields;

    public DiffReportBuilder(Set<String> htmlFields) {
        this.htmlFields = htmlFields != null ? htmlFields : Collections.emptySet();
    }

    /**
     * Build one report line per affected key, keys in first-seen order
     *
     * @param entries diff entries
     * @param staging staging catalog, source of the auxiliary column
     * @return grouped lines, empty when there is nothing to report
     */
    public List<ReportLine> build(List<DiffEntry> entries, CatalogModel staging) {
        Map<String, ReportLine> grouped = new LinkedHashMap<>();
        for (DiffEntry entry : entries) {
            ReportLine line = grouped.computeIfAbsent(entry.getKey(), ReportLine::new);
            line.addDifference(render(entry));
        }

        for (ReportLine line : grouped.values()) {
            CatalogRecord record = staging != null ? staging.getRecord(line.getKey()) : null;
            line.setProductWebsites(record != null ? record.getOrEmpty(PRODUCT_WEBSITES) : "");
        }
        return new ArrayList<>(grouped.values());
    }

    /**
     * Build the report and hand it to a sink. Nothing is written when there are no entries.
     *
     * @return the lines written, empty when there was nothing to report
     */
    public List<ReportLine> write(List<DiffEntry> entries, CatalogModel staging, String keyField, ReportSink sink)
            throws IOException {
        if (entries.isEmpty()) {
            log.info("No differences found between the two catalogs");
            return Collections.emptyList();
        }
        List<ReportLine> lines = build(entries, staging);
        sink.write(keyField, lines);
        return lines;
    }

    /**
     * Render one entry: a fixed token for record-level entries,
     * "field [staging → production]" otherwise
     */
    String render(DiffEntry entry) {
        if (entry.getType().isRecordLevel()) {
            return entry.getType().getLabel();
        }
        String field = entry.getField();
        String stagingValue = entry.getStagingValue();
        String productionValue = entry.getProductionValue();
        if (requiresEscaping(field)) {
            stagingValue = escape(stagingValue);
            productionValue = escape(productionValue);
        }
        return field + " [" + stagingValue + ARROW + productionValue + "]";
    }

    boolean requiresEscaping(String field) {
        for (String htmlField : htmlFields) {
            if (field.equals(htmlField) || field.startsWith(htmlField + ":")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Markup-escape {@code & < > " '} and leave every other character as is
     */
    static String escape(String value) {
        return ESCAPE_MARKUP.translate(value);
    }
}
