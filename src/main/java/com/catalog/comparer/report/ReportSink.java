package com.catalog.comparer.report;

import com.catalog.comparer.model.ReportLine;

import java.io.IOException;
import java.util.List;

/**
 * Destination for grouped report lines
 */
public interface ReportSink {

    /**
     * Persist the report
     *
     * @param keyField name of the key column, used as the first header
     * @param lines one line per affected key, never empty
     */
    void write(String keyField, List<ReportLine> lines) throws IOException;
}
