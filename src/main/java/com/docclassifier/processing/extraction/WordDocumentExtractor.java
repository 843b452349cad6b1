package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.ContentTable;
import com.docclassifier.processing.model.DocumentFormat;
import com.docclassifier.processing.model.ExtractedContent;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.hwpf.usermodel.HeaderStories;
import org.apache.poi.hwpf.usermodel.Range;
import org.apache.poi.hwpf.usermodel.Table;
import org.apache.poi.hwpf.usermodel.TableIterator;
import org.apache.poi.hwpf.usermodel.TableRow;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Word documents: {@code .docx} through XWPF and legacy {@code .doc} through HWPF.
 */
@Component
public class WordDocumentExtractor extends AbstractDocumentExtractor {

    @Override
    public Set<String> supportedMediaTypes() {
        return Set.of(MediaTypeDetector.DOCX, MediaTypeDetector.DOC);
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.WORD;
    }

    @Override
    protected ExtractedContent doExtract(byte[] content) throws IOException {
        if (FileMagic.valueOf(content) == FileMagic.OLE2) {
            return extractDoc(content);
        }
        return extractDocx(content);
    }

    private ExtractedContent extractDocx(byte[] content) throws IOException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            ExtractedContent.Builder builder = ExtractedContent.builder(DocumentFormat.WORD)
                    .mediaType(MediaTypeDetector.DOCX);

            StringBuilder text = new StringBuilder();
            int paragraphs = 0;
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String paragraphText = paragraph.getText();
                if (paragraphText != null && !paragraphText.isBlank()) {
                    text.append(paragraphText).append('\n');
                    paragraphs++;
                }
            }

            for (XWPFTable table : document.getTables()) {
                List<List<String>> rows = new ArrayList<>();
                for (XWPFTableRow row : table.getRows()) {
                    List<String> cells = new ArrayList<>();
                    for (XWPFTableCell cell : row.getTableCells()) {
                        cells.add(cleanText(cell.getText()));
                    }
                    rows.add(cells);
                    text.append(String.join(" ", cells)).append('\n');
                }
                builder.addTable(new ContentTable(rows));
            }

            for (XWPFHeader header : document.getHeaderList()) {
                builder.addHeader(cleanText(header.getText()));
            }
            for (XWPFFooter footer : document.getFooterList()) {
                builder.addFooter(cleanText(footer.getText()));
            }

            POIXMLProperties properties = document.getProperties();
            if (properties != null) {
                builder.property("title", properties.getCoreProperties().getTitle())
                        .property("author", properties.getCoreProperties().getCreator());
                int pages = properties.getExtendedProperties().getPages();
                if (pages > 0) {
                    builder.pageCount(pages);
                }
            }

            return builder.rawText(cleanText(text.toString()))
                    .property("paragraph_count", paragraphs)
                    .property("embedded_images", document.getAllPictures().size())
                    .build();
        }
    }

    private ExtractedContent extractDoc(byte[] content) throws IOException {
        HWPFDocument document = new HWPFDocument(new ByteArrayInputStream(content));
        // closing the extractor closes the document
        try (WordExtractor extractor = new WordExtractor(document)) {
            ExtractedContent.Builder builder = ExtractedContent.builder(DocumentFormat.WORD)
                    .mediaType(MediaTypeDetector.DOC);

            StringBuilder text = new StringBuilder();
            int paragraphs = 0;
            for (String paragraph : extractor.getParagraphText()) {
                if (paragraph != null && !paragraph.isBlank()) {
                    text.append(paragraph).append('\n');
                    paragraphs++;
                }
            }

            Range range = document.getRange();
            TableIterator tables = new TableIterator(range);
            while (tables.hasNext()) {
                Table table = tables.next();
                List<List<String>> rows = new ArrayList<>();
                for (int r = 0; r < table.numRows(); r++) {
                    TableRow row = table.getRow(r);
                    List<String> cells = new ArrayList<>();
                    for (int c = 0; c < row.numCells(); c++) {
                        cells.add(cleanText(row.getCell(c).text()));
                    }
                    rows.add(cells);
                }
                builder.addTable(new ContentTable(rows));
            }

            HeaderStories stories = new HeaderStories(document);
            builder.addHeader(cleanText(stories.getFirstHeader()))
                    .addHeader(cleanText(stories.getOddHeader()))
                    .addHeader(cleanText(stories.getEvenHeader()))
                    .addFooter(cleanText(stories.getFirstFooter()))
                    .addFooter(cleanText(stories.getOddFooter()))
                    .addFooter(cleanText(stories.getEvenFooter()));

            SummaryInformation summary = document.getSummaryInformation();
            if (summary != null) {
                builder.property("title", summary.getTitle())
                        .property("author", summary.getAuthor());
                if (summary.getPageCount() > 0) {
                    builder.pageCount(summary.getPageCount());
                }
            }

            return builder.rawText(cleanText(text.toString()))
                    .property("paragraph_count", paragraphs)
                    .property("embedded_images", document.getPicturesTable().getAllPictures().size())
                    .build();
        }
    }
}
