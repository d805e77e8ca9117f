package com.catalog.comparer.comparison;

import com.catalog.comparer.config.ComparisonConfig;
import com.catalog.comparer.model.CatalogModel;
import com.catalog.comparer.model.CatalogRecord;
import com.catalog.comparer.model.comparison.CatalogComparison;
import com.catalog.comparer.model.comparison.DiffEntry;
import com.catalog.comparer.parser.AttributeCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Comparator for catalog-level comparisons.
 * <p>
 * Staging keys are visited in order: a key absent from production yields a single
 * missing entry, otherwise every staging column is compared (the free-text column
 * sub-attribute by sub-attribute). Production-only keys are appended last.
 */
@Slf4j
public class CatalogComparator {

    /**
     * Compare two catalogs using the columns, separators and exclusions of a config
     */
    public static CatalogComparison compare(CatalogModel staging, CatalogModel production, ComparisonConfig config) {
        return compare(staging, production,
                config.getExcludeColumns(),
                config.getSpecialField(),
                config.getAttrSeparator(),
                config.getExcludeAdditionalAttributes(),
                config.getKeyField());
    }

    /**
     * Compare two catalogs
     *
     * @param staging upstream catalog
     * @param production catalog expected to reflect staging
     * @param ignoredColumns columns skipped entirely
     * @param freeTextColumn column holding the compound attribute list
     * @param attrSeparator separator between attribute pairs
     * @param ignoredAttributes sub-keys skipped inside the free-text column
     * @param keyColumn key column name
     * @return ordered diff entries with summary counters
     */
    public static CatalogComparison compare(CatalogModel staging,
                                            CatalogModel production,
                                            Set<String> ignoredColumns,
                                            String freeTextColumn,
                                            String attrSeparator,
                                            Set<String> ignoredAttributes,
                                            String keyColumn) {
        Set<String> skipColumns = ignoredColumns != null ? ignoredColumns : Collections.emptySet();
        Set<String> skipAttributes = ignoredAttributes != null ? ignoredAttributes : Collections.emptySet();

        log.info("Comparing catalogs '{}' ({} records) and '{}' ({} records) on key '{}'",
                staging.getName(), staging.size(), production.getName(), production.size(), keyColumn);

        CatalogComparison comparison = new CatalogComparison();
        comparison.setStagingName(staging.getName());
        comparison.setProductionName(production.getName());
        comparison.setStagingRecords(staging.size());
        comparison.setProductionRecords(production.size());

        for (Map.Entry<String, CatalogRecord> stagingEntry : staging.getRecords().entrySet()) {
            String key = stagingEntry.getKey();
            CatalogRecord stagingRecord = stagingEntry.getValue();
            CatalogRecord productionRecord = production.getRecord(key);

            if (productionRecord == null) {
                comparison.addEntry(DiffEntry.missingInProduction(key));
                continue;
            }

            for (String column : stagingRecord.getFields().keySet()) {
                if (skipColumns.contains(column)) {
                    continue;
                }

                String stagingValue = stagingRecord.getOrEmpty(column).trim();
                String productionValue = productionRecord.getOrEmpty(column).trim();

                if (column.equals(freeTextColumn)) {
                    for (DiffEntry entry : compareAttributes(key, column, stagingValue, productionValue,
                            attrSeparator, skipAttributes)) {
                        comparison.addEntry(entry);
                    }
                } else if (!stagingValue.equals(productionValue)) {
                    comparison.addEntry(DiffEntry.differentValue(key, column, stagingValue, productionValue));
                }
            }
        }

        for (String key : production.getRecords().keySet()) {
            if (!staging.containsKey(key)) {
                comparison.addEntry(DiffEntry.extraInProduction(key));
            }
        }

        log.info("Catalog comparison complete: {} diff entries", comparison.getEntries().size());
        return comparison;
    }

    /**
     * Symmetric sub-attribute difference. A sub-key is reported when its values differ
     * or when it is present on one side only; an absent side reads as "".
     */
    static List<DiffEntry> compareAttributes(String key,
                                             String column,
                                             String stagingValue,
                                             String productionValue,
                                             String attrSeparator,
                                             Set<String> ignoredAttributes) {
        Map<String, String> stagingAttrs = AttributeCodec.decode(stagingValue, attrSeparator);
        Map<String, String> productionAttrs = AttributeCodec.decode(productionValue, attrSeparator);

        Set<String> subKeys = new LinkedHashSet<>(stagingAttrs.keySet());
        subKeys.addAll(productionAttrs.keySet());

        List<DiffEntry> entries = new ArrayList<>();
        for (String subKey : subKeys) {
            if (ignoredAttributes.contains(subKey)) {
                log.debug("Attribute '{}' of '{}' ignored", subKey, key);
                continue;
            }
            String left = stagingAttrs.get(subKey);
            String right = productionAttrs.get(subKey);
            boolean oneSided = left == null || right == null;
            String leftValue = left != null ? left.trim() : "";
            String rightValue = right != null ? right.trim() : "";
            if (oneSided || !leftValue.equals(rightValue)) {
                entries.add(DiffEntry.differentAttribute(key, column, subKey, leftValue, rightValue));
            }
        }
        return entries;
    }
}
