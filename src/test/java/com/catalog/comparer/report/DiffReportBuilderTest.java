package com.catalog.comparer.report;

import com.catalog.comparer.model.CatalogModel;
import com.catalog.comparer.model.CatalogRecord;
import com.catalog.comparer.model.ReportLine;
import com.catalog.comparer.model.comparison.DiffEntry;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test grouping and rendering of report lines
 */
class DiffReportBuilderTest {

    private CatalogModel staging;

    @BeforeEach
    void setUp() {
        Map<String, CatalogRecord> records = new LinkedHashMap<>();
        records.put("A1", record("A1", "base,eu"));
        records.put("B2", record("B2", "base"));
        staging = new CatalogModel("staging", Arrays.asList("sku", "product_websites"), records);
    }

    @Test
    @DisplayName("Entries are grouped per key in first-seen order with the staging websites")
    void testGrouping() {
        List<DiffEntry> entries = Arrays.asList(
                DiffEntry.differentValue("A1", "color", "red", "blue"),
                DiffEntry.missingInProduction("B2"),
                DiffEntry.differentAttribute("A1", "additional_attributes", "size", "M", "L"),
                DiffEntry.extraInProduction("Z9"));

        List<ReportLine> lines = new DiffReportBuilder(Collections.emptySet()).build(entries, staging);

        assertEquals(3, lines.size());

        ReportLine a1 = lines.get(0);
        assertEquals("A1", a1.getKey());
        assertEquals("base,eu", a1.getProductWebsites());
        assertEquals("color [red → blue]; additional_attributes:size [M → L]", a1.getJoinedDifferences());

        ReportLine b2 = lines.get(1);
        assertEquals("B2", b2.getKey());
        assertEquals("base", b2.getProductWebsites());
        assertEquals(Collections.singletonList("missing_in_production"), b2.getDifferences());

        ReportLine z9 = lines.get(2);
        assertEquals("Z9", z9.getKey());
        assertEquals("", z9.getProductWebsites(), "Key absent from staging has no websites");
        assertEquals("extra_in_production", z9.getJoinedDifferences());
    }

    @Test
    @DisplayName("Values of configured fields are markup-escaped, others are left raw")
    void testEscaping() {
        DiffReportBuilder builder = new DiffReportBuilder(new HashSet<>(Arrays.asList("description", "additional_attributes")));

        assertEquals("description [&lt;b&gt;Café&lt;/b&gt; → &lt;p&gt;&#x27;x&#x27; &amp; &quot;y&quot;&lt;/p&gt;]",
                builder.render(DiffEntry.differentValue("A1", "description", "<b>Café</b>", "<p>'x' & \"y\"</p>")));
        assertEquals("additional_attributes:note [a&amp;b → a]",
                builder.render(DiffEntry.differentAttribute("A1", "additional_attributes", "note", "a&b", "a")));
        assertEquals("color [<x> → <y>]",
                builder.render(DiffEntry.differentValue("A1", "color", "<x>", "<y>")));
    }

    @Test
    @DisplayName("Escaping leaves control and non-ASCII characters untouched")
    void testEscapeOnlyMarkupCharacters() {
        assertEquals("a\u000Bb\u0080c\u007Fé", DiffReportBuilder.escape("a\u000Bb\u0080c\u007Fé"));
        assertEquals("&lt;a href=&quot;x&quot;&gt;&#x27;&amp;", DiffReportBuilder.escape("<a href=\"x\">'&"));

        DiffReportBuilder builder = new DiffReportBuilder(Collections.singleton("description"));
        assertEquals("description [tab\u000Bbed → &lt;b&gt;]",
                builder.render(DiffEntry.differentValue("A1", "description", "tab\u000Bbed", "<b>")));
    }

    @Test
    @DisplayName("Escaping matches whole field names or sub-field prefixes only")
    void testRequiresEscaping() {
        DiffReportBuilder builder = new DiffReportBuilder(new HashSet<>(Arrays.asList("desc", "additional_attributes:note")));

        assertTrue(builder.requiresEscaping("desc"));
        assertTrue(builder.requiresEscaping("desc:sub"));
        assertTrue(builder.requiresEscaping("additional_attributes:note"));
        assertFalse(builder.requiresEscaping("description"));
        assertFalse(builder.requiresEscaping("additional_attributes:size"));
    }

    @Test
    @DisplayName("Empty diff writes nothing to the sink")
    void testEmptyDiff() throws IOException {
        List<List<ReportLine>> written = new ArrayList<>();
        ReportSink sink = (keyField, lines) -> written.add(lines);

        List<ReportLine> lines = new DiffReportBuilder(null).write(Collections.emptyList(), staging, "sku", sink);

        assertTrue(lines.isEmpty());
        assertTrue(written.isEmpty(), "Sink should not be invoked");
    }

    @Test
    @DisplayName("Non-empty diff is handed to the sink once")
    void testWriteToSink() throws IOException {
        List<String> keyFields = new ArrayList<>();
        ReportSink sink = (keyField, lines) -> keyFields.add(keyField + ":" + lines.size());

        new DiffReportBuilder(null).write(Collections.singletonList(DiffEntry.missingInProduction("B2")),
                staging, "sku", sink);

        assertEquals(Collections.singletonList("sku:1"), keyFields);
    }

    private static CatalogRecord record(String key, String websites) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("sku", key);
        fields.put("product_websites", websites);
        return new CatalogRecord(key, fields);
    }
}
