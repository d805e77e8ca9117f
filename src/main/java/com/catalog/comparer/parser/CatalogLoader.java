package com.catalog.comparer.parser;

import com.catalog.comparer.config.ComparisonConfig;
import com.catalog.comparer.model.CatalogModel;
import com.catalog.comparer.model.CatalogRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a delimited catalog document into a {@link CatalogModel}.
 * <p>
 * Each record goes through three phases: the free-text column is protected with
 * placeholders, the protected record is parsed as an ordinary delimited record, and the
 * placeholders in the free-text value are restored.
 */
@Slf4j
public class CatalogLoader {

    private static final char BOM = '\uFEFF';

    private final char delimiter;
    private final String freeTextColumn;
    private final String keyColumn;
    private final CSVFormat recordFormat;

    public CatalogLoader(char delimiter, String freeTextColumn, String keyColumn) {
        this.delimiter = delimiter;
        this.freeTextColumn = freeTextColumn;
        this.keyColumn = keyColumn;
        this.recordFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setTrailingData(true)
                .build();
    }

    public static CatalogLoader fromConfig(ComparisonConfig config) {
        return new CatalogLoader(config.delimiterChar(), config.getSpecialField(), config.getKeyField());
    }

    /**
     * Read and parse a catalog file (UTF-8, optional BOM)
     *
     * @throws IOException if the file is missing or unreadable
     */
    public CatalogModel load(Path path) throws IOException {
        log.info("Loading catalog from: {}", path);
        if (!Files.exists(path)) {
            throw new IOException("Catalog file not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Path fileName = path.getFileName();
        return parse(content, fileName != null ? fileName.toString() : path.toString());
    }

    /**
     * Parse catalog text. The first record is the header.
     *
     * @param content full document text
     * @param name display name used in log messages
     * @throws IOException if the header cannot be parsed
     */
    public CatalogModel parse(String content, String name) throws IOException {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }

        if (content.isEmpty()) {
            log.info("Catalog '{}' is empty", name);
            return CatalogModel.empty(name);
        }

        StringBuilder headerRecord = new StringBuilder();
        int bodyStart = scanRecord(content, 0, delimiter, RowParser.NO_FREE_TEXT, headerRecord);
        List<String> columns = parseHeader(headerRecord.toString(), name);
        int freeTextIndex = columns.indexOf(freeTextColumn);
        if (freeTextIndex < 0) {
            log.debug("Free-text column '{}' not in header of '{}', protection disabled", freeTextColumn, name);
        }
        if (!columns.contains(keyColumn)) {
            log.warn("Key column '{}' not in header of '{}', no record will be loaded", keyColumn, name);
        }
        List<String> rawRecords = splitRecords(content, bodyStart, delimiter, freeTextIndex);

        Map<String, CatalogRecord> records = new LinkedHashMap<>();
        int dropped = 0;
        int unparsable = 0;

        for (int r = 0; r < rawRecords.size(); r++) {
            int i = r + 1;
            String line = rawRecords.get(r);
            if (line.isEmpty()) {
                continue;
            }

            String protectedLine = RowParser.protectFreeText(line, delimiter, freeTextIndex);
            List<String> values;
            try {
                values = parseRecord(protectedLine);
            } catch (IOException | UncheckedIOException e) {
                log.warn("Skipping unparsable record {} in '{}': {}", i, name, e.getMessage());
                unparsable++;
                continue;
            }

            Map<String, String> fields = toFields(columns, values, i, name);
            if (freeTextIndex >= 0) {
                fields.computeIfPresent(freeTextColumn, (column, value) -> FreeTextPlaceholders.restore(value, delimiter));
            }

            String key = fields.get(keyColumn);
            if (key == null || key.trim().isEmpty()) {
                log.debug("Dropping record {} in '{}': empty key", i, name);
                dropped++;
                continue;
            }
            key = key.trim();
            records.put(key, new CatalogRecord(key, fields));
        }

        log.info("Loaded {} records from '{}' ({} without key, {} unparsable)",
                records.size(), name, dropped, unparsable);
        return new CatalogModel(name, columns, records);
    }

    private List<String> parseHeader(String headerLine, String name) throws IOException {
        try {
            List<String> header = parseRecord(headerLine);
            log.debug("Header of '{}': {}", name, header);
            return header;
        } catch (IOException | UncheckedIOException e) {
            throw new IOException("Unparsable header in '" + name + "'", e);
        }
    }

    private List<String> parseRecord(String line) throws IOException {
        try (CSVParser parser = CSVParser.parse(line, recordFormat)) {
            List<CSVRecord> parsed = parser.getRecords();
            if (parsed.isEmpty()) {
                return new ArrayList<>();
            }
            if (parsed.size() > 1) {
                log.debug("Record split into {} parts by the delimited parser, keeping the first", parsed.size());
            }
            CSVRecord record = parsed.get(0);
            List<String> values = new ArrayList<>(record.size());
            for (String value : record) {
                values.add(value);
            }
            return values;
        }
    }

    private Map<String, String> toFields(List<String> columns, List<String> values, int recordNumber, String name) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            String value = c < values.size() ? values.get(c) : null;
            fields.put(columns.get(c), value != null ? value : "");
        }
        if (values.size() > columns.size()) {
            log.debug("Record {} in '{}' has {} surplus fields, ignored",
                    recordNumber, name, values.size() - columns.size());
        }
        return fields;
    }

    /**
     * Split document text into logical records. A line break inside a double-quoted
     * field belongs to the record; quotes only open a field when they start it, and a
     * doubled quote inside a quoted field is an escape.
     */
    static List<String> splitRecords(String text, char delimiter) {
        return splitRecords(text, 0, delimiter, RowParser.NO_FREE_TEXT);
    }

    /**
     * Split document text into logical records from an offset. The free-text field may
     * also be wrapped in single quotes.
     */
    static List<String> splitRecords(String text, int start, char delimiter, int freeTextIndex) {
        List<String> records = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int next = start;
        while (next < text.length()) {
            current.setLength(0);
            next = scanRecord(text, next, delimiter, freeTextIndex, current);
            records.add(current.toString());
        }
        return records;
    }

    /**
     * Append one logical record starting at {@code start} to {@code record}
     *
     * @return offset of the next record, past the line break
     */
    private static int scanRecord(String text, int start, char delimiter, int freeTextIndex, StringBuilder record) {
        char openQuote = 0;
        boolean fieldStart = true;
        int fieldIndex = 0;

        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (openQuote != 0) {
                record.append(ch);
                if (ch == openQuote) {
                    if (ch == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        record.append('"');
                        i++;
                    } else {
                        openQuote = 0;
                    }
                }
            } else if (ch == '\r' || ch == '\n') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                return i + 1;
            } else {
                record.append(ch);
                if (fieldStart && (ch == '"' || (ch == '\'' && fieldIndex == freeTextIndex))) {
                    openQuote = ch;
                }
                if (ch == delimiter) {
                    fieldIndex++;
                    fieldStart = true;
                } else {
                    fieldStart = false;
                }
            }
        }
        return text.length();
    }
}
