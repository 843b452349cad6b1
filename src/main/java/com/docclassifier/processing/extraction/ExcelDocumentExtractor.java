package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.ContentTable;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Spreadsheets through {@link WorkbookFactory}. Every sheet contributes a "Sheet: name" line
 * followed by its cell text; blank rows split a sheet into separate tables.
 */
@Component
public class ExcelDocumentExtractor extends AbstractDocumentExtractor {

    private static final int MIN_TABLE_ROWS = 2;

    @Override
    public Set<String> supportedMediaTypes() {
        return Set.of(MediaTypeDetector.XLSX, MediaTypeDetector.XLS);
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.EXCEL;
    }

    @Override
    protected ExtractedContent doExtract(byte[] content) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            ExtractedContent.Builder builder = ExtractedContent.builder(DocumentFormat.EXCEL)
                    .mediaType(workbook.getSpreadsheetVersion() == SpreadsheetVersion.EXCEL97
                            ? MediaTypeDetector.XLS : MediaTypeDetector.XLSX);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            StringBuilder text = new StringBuilder();
            int mergedCells = 0;
            for (Sheet sheet : workbook) {
                text.append("Sheet: ").append(sheet.getSheetName()).append('\n');
                mergedCells += sheet.getNumMergedRegions();

                List<List<String>> current = new ArrayList<>();
                boolean headerTaken = false;
                for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                    List<String> cells = readRow(sheet.getRow(r), formatter, evaluator);
                    if (cells.isEmpty()) {
                        flushTable(current, builder);
                        continue;
                    }
                    if (!headerTaken) {
                        builder.addHeader(String.join(" | ", nonBlank(cells)));
                        headerTaken = true;
                    }
                    current.add(cells);
                    text.append(String.join(" ", nonBlank(cells))).append('\n');
                }
                flushTable(current, builder);
            }

            return builder.rawText(cleanText(text.toString()))
                    .property("sheet_count", workbook.getNumberOfSheets())
                    .property("merged_cells", mergedCells)
                    .build();
        }
    }

    /**
     * @return the row's formatted cells, or an empty list when the row is missing or blank
     */
    private List<String> readRow(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (row == null || row.getLastCellNum() <= 0) {
            return List.of();
        }
        List<String> cells = new ArrayList<>();
        boolean any = false;
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            String value = cell == null ? "" : format(cell, formatter, evaluator);
            any |= !value.isBlank();
            cells.add(value);
        }
        return any ? cells : List.of();
    }

    private String format(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        try {
            return formatter.formatCellValue(cell, evaluator).trim();
        } catch (RuntimeException e) {
            // unsupported formula functions; fall back to the cell's own representation
            logger.debug("Formula evaluation failed at {}: {}", cell.getAddress(), e.getMessage());
            return formatter.formatCellValue(cell).trim();
        }
    }

    private static void flushTable(List<List<String>> rows, ExtractedContent.Builder builder) {
        if (rows.size() >= MIN_TABLE_ROWS) {
            builder.addTable(new ContentTable(new ArrayList<>(rows)));
        }
        rows.clear();
    }

    private static List<String> nonBlank(List<String> cells) {
        List<String> result = new ArrayList<>();
        for (String cell : cells) {
            if (!cell.isBlank()) {
                result.add(cell);
            }
        }
        return result;
    }
}
