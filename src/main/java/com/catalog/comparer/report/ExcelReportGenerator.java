package com.catalog.comparer.report;

import com.catalog.comparer.model.ReportLine;
import com.catalog.comparer.model.comparison.CatalogComparison;
import com.catalog.comparer.model.comparison.DiffEntry;
import com.catalog.comparer.model.comparison.DiffType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates an Excel workbook from a catalog comparison
 */
@Slf4j
public class ExcelReportGenerator implements ReportSink {

    static final String SHEET_SUMMARY = "Summary";
    static final String SHEET_DETAILS = "Details";
    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private final Path outputPath;
    private final CatalogComparison comparison;

    public ExcelReportGenerator(Path outputPath, CatalogComparison comparison) {
        this.outputPath = outputPath;
        this.comparison = comparison;
    }

    @Override
    public void write(String keyField, List<ReportLine> lines) throws IOException {
        log.info("Generating Excel report to: {}", outputPath);

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle differentStyle = createFillStyle(workbook, IndexedColors.LIGHT_ORANGE);
            CellStyle missingStyle = createFillStyle(workbook, IndexedColors.CORAL);
            CellStyle extraStyle = createFillStyle(workbook, IndexedColors.LIGHT_TURQUOISE);

            generateSummarySheet(workbook, keyField, lines, headerStyle);
            generateDetailsSheet(workbook, keyField, headerStyle, differentStyle, missingStyle, extraStyle);

            try (OutputStream fileOut = Files.newOutputStream(outputPath)) {
                workbook.write(fileOut);
            }
        }
        log.info("Excel report generated successfully: {}", outputPath);
    }

    /**
     * Summary Sheet
     * Columns: No | Key | product_websites | Differences
     */
    private void generateSummarySheet(Workbook workbook, String keyField, List<ReportLine> lines,
                                      CellStyle headerStyle) {
        Sheet sheet = workbook.createSheet(SHEET_SUMMARY);

        Row headerRow = sheet.createRow(0);
        createCell(headerRow, 0, "No", headerStyle);
        createCell(headerRow, 1, keyField, headerStyle);
        createCell(headerRow, 2, DiffReportBuilder.PRODUCT_WEBSITES, headerStyle);
        createCell(headerRow, 3, DiffReportBuilder.DIFFERENCES, headerStyle);

        int rowNum = 1;
        for (ReportLine line : lines) {
            Row row = sheet.createRow(rowNum);
            createCell(row, 0, String.valueOf(rowNum), null);
            createCell(row, 1, line.getKey(), null);
            createCell(row, 2, line.getProductWebsites(), null);
            createCell(row, 3, line.getJoinedDifferences(), null);
            rowNum++;
        }

        // Set column widths manually (to avoid AWT dependency in headless mode)
        sheet.setColumnWidth(0, 2000);
        sheet.setColumnWidth(1, 6000);
        sheet.setColumnWidth(2, 8000);
        sheet.setColumnWidth(3, 20000);
    }

    /**
     * Details Sheet
     * Columns: No | Key | Type | Field | Staging Value | Production Value
     */
    private void generateDetailsSheet(Workbook workbook, String keyField, CellStyle headerStyle,
                                      CellStyle differentStyle, CellStyle missingStyle, CellStyle extraStyle) {
        Sheet sheet = workbook.createSheet(SHEET_DETAILS);

        Row headerRow = sheet.createRow(0);
        createCell(headerRow, 0, "No", headerStyle);
        createCell(headerRow, 1, keyField, headerStyle);
        createCell(headerRow, 2, "Type", headerStyle);
        createCell(headerRow, 3, "Field", headerStyle);
        createCell(headerRow, 4, "Staging Value", headerStyle);
        createCell(headerRow, 5, "Production Value", headerStyle);

        int rowNum = 1;
        for (DiffEntry entry : comparison.getEntries()) {
            CellStyle style = getTypeStyle(entry.getType(), differentStyle, missingStyle, extraStyle);
            Row row = sheet.createRow(rowNum);
            createCell(row, 0, String.valueOf(rowNum), null);
            createCell(row, 1, entry.getKey(), null);
            createCell(row, 2, entry.getType().getLabel(), style);
            createCell(row, 3, entry.getField(), null);
            createCell(row, 4, entry.getStagingValue(), null);
            createCell(row, 5, entry.getProductionValue(), null);
            rowNum++;
        }

        sheet.setColumnWidth(0, 2000);
        sheet.setColumnWidth(1, 6000);
        sheet.setColumnWidth(2, 9000);
        sheet.setColumnWidth(3, 10000);
        sheet.setColumnWidth(4, 12000);
        sheet.setColumnWidth(5, 12000);
    }

    private CellStyle getTypeStyle(DiffType type, CellStyle differentStyle,
                                   CellStyle missingStyle, CellStyle extraStyle) {
        switch (type) {
            case MISSING_IN_PRODUCTION:
                return missingStyle;
            case EXTRA_IN_PRODUCTION:
                return extraStyle;
            default:
                return differentStyle;
        }
    }

    private void createCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        if (value != null && value.length() > MAX_CELL_TEXT) {
            log.debug("Truncating {} chars in row {} column {}", value.length(), row.getRowNum(), column);
            value = value.substring(0, MAX_CELL_TEXT);
        }
        cell.setCellValue(value);
        if (style != null) {
            cell.setCellStyle(style);
        }
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        setThinBorders(style);
        return style;
    }

    private CellStyle createFillStyle(Workbook workbook, IndexedColors color) {
        CellStyle style = workbook.createCellStyle();
        style.setFillForegroundColor(color.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        setThinBorders(style);
        return style;
    }

    private void setThinBorders(CellStyle style) {
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }
}
