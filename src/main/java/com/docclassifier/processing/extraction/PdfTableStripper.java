package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.ContentTable;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Text stripper that also lifts column-aligned text out of the page. A line is split into
 * cells wherever the horizontal gap between glyphs is several space widths wide; two or more
 * consecutive lines with the same number of cells (at least two) form a table.
 * The text written by {@link PDFTextStripper} is unchanged.
 */
class PdfTableStripper extends PDFTextStripper {

    private static final float CELL_GAP_SPACES = 2.5f;
    private static final float FALLBACK_SPACE_WIDTH = 3.0f;
    private static final int MIN_TABLE_ROWS = 2;
    private static final int MIN_TABLE_COLUMNS = 2;

    private final List<TextPosition> currentLine = new ArrayList<>();
    private final List<List<String>> currentRun = new ArrayList<>();
    private final List<ContentTable> tables = new ArrayList<>();

    List<ContentTable> getTables() {
        return tables;
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        currentLine.addAll(textPositions);
        super.writeString(text, textPositions);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        finishLine();
        super.writeLineSeparator();
    }

    @Override
    protected void writeParagraphEnd() throws IOException {
        finishLine();
        super.writeParagraphEnd();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        finishLine();
        finishRun();
        super.endPage(page);
    }

    private void finishLine() {
        if (currentLine.isEmpty()) {
            return;
        }
        List<String> cells = splitCells(currentLine);
        currentLine.clear();

        if (cells.size() < MIN_TABLE_COLUMNS) {
            finishRun();
            return;
        }
        if (!currentRun.isEmpty() && currentRun.get(0).size() != cells.size()) {
            finishRun();
        }
        currentRun.add(cells);
    }

    private void finishRun() {
        if (currentRun.size() >= MIN_TABLE_ROWS) {
            tables.add(new ContentTable(new ArrayList<>(currentRun)));
        }
        currentRun.clear();
    }

    static List<String> splitCells(List<TextPosition> positions) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        float lastEnd = Float.NaN;
        for (TextPosition position : positions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                // spaces only widen the gap measured from the previous glyph
                if (cell.length() > 0) {
                    cell.append(' ');
                }
                continue;
            }
            float start = position.getXDirAdj();
            if (!Float.isNaN(lastEnd) && start - lastEnd > CELL_GAP_SPACES * spaceWidth(position)) {
                addCell(cells, cell);
                cell.setLength(0);
            }
            cell.append(unicode);
            lastEnd = start + position.getWidthDirAdj();
        }
        addCell(cells, cell);
        return cells;
    }

    private static void addCell(List<String> cells, StringBuilder cell) {
        String text = cell.toString().trim();
        if (!text.isEmpty()) {
            cells.add(text);
        }
    }

    private static float spaceWidth(TextPosition position) {
        float width = position.getWidthOfSpace();
        return width > 0 && !Float.isNaN(width) && !Float.isInfinite(width) ? width : FALLBACK_SPACE_WIDTH;
    }
}
