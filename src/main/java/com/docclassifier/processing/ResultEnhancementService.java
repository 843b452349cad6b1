package com.docclassifier.processing;

import com.docclassifier.processing.model.ClassificationResult;
import com.docclassifier.processing.model.ContentTable;
import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.processing.model.Enhancement;
import com.docclassifier.processing.model.TableSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural post-pass over a classification. Adds table summaries, format features and
 * content metadata; never changes the document type or confidence.
 */
@Service
public class ResultEnhancementService {

    private static final Logger logger = LoggerFactory.getLogger(ResultEnhancementService.class);

    static final int MAX_EXTRACTED_VALUES = 10;

    private static final List<String> FINANCIAL_TABLE_WORDS = List.of("amount", "total", "balance", "price");
    private static final List<String> HEADER_WORDS = List.of("total", "sum", "amount", "date", "description",
            "name", "qty", "quantity", "item");

    private static final List<String> DOCUMENT_PROPERTIES = List.of("title", "author", "producer");

    private static final Pattern NUMERIC = Pattern.compile("^[-+(]?[$€£]?\\s?\\d[\\d,]*(\\.\\d+)?\\)?%?$");

    private static final Pattern DATE = Pattern.compile(
            "\\b(?:\\d{4}-\\d{2}-\\d{2}"
                    + "|\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"
                    + "|(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AMOUNT = Pattern.compile("[$€£]\\s?\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?|[$€£]\\s?\\d+(?:\\.\\d{2})?");

    private static final Pattern PAGE_NUMBER = Pattern.compile(
            "\\bpage\\s+\\d+|\\b\\d+\\s+of\\s+\\d+\\b|^\\s*-?\\s*\\d+\\s*-?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern CONFIDENTIAL = Pattern.compile("\\b(confidential|disclaimer|privacy|draft)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COPYRIGHT = Pattern.compile("copyright|©|\\(c\\)|all rights reserved",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTACT = Pattern.compile("tel:|phone:|fax:|email:|www\\.|https?://|[\\w.+-]+@[\\w-]+\\.[\\w.]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_LABEL = Pattern.compile("\\b(date:|dated:|as of)", Pattern.CASE_INSENSITIVE);

    public ClassificationResult enhance(ExtractedContent content, ClassificationResult result) {
        List<TableSummary> summaries = new ArrayList<>();
        for (ContentTable table : content.getTables()) {
            summaries.add(summarize(table));
        }

        Enhancement enhancement = new Enhancement(summaries.size(), summaries, formatFeatures(content));

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (content.getPageCount() != null) {
            metadata.put("page_count", content.getPageCount());
        }
        for (String key : DOCUMENT_PROPERTIES) {
            Object value = content.getProperty(key);
            if (value instanceof String && !((String) value).isBlank()) {
                metadata.put(key, ((String) value).trim());
            }
        }
        metadata.put("content_length", content.getRawText().length());
        metadata.put("table_count", content.getTables().size());
        metadata.put("dates", findAll(DATE, content.getRawText()));
        metadata.put("amounts", findAll(AMOUNT, content.getRawText()));
        if (!content.getHeaders().isEmpty() || !content.getFooters().isEmpty()) {
            metadata.put("header_patterns", analyzeMargins(content.getHeaders()));
            metadata.put("footer_patterns", analyzeMargins(content.getFooters()));
        }

        logger.debug("Enhanced {} result: {} tables, {} format features",
                content.getFormat(), summaries.size(), enhancement.getFormatFeatures().size());
        return result.withEnhancement(enhancement, metadata);
    }

    TableSummary summarize(ContentTable table) {
        return new TableSummary(table.getRowCount(), table.getColumnCount(), hasHeaderRow(table), tableKind(table));
    }

    static boolean hasHeaderRow(ContentTable table) {
        List<String> first = table.getFirstRow();
        if (first.isEmpty() || table.getRowCount() < 2) {
            return false;
        }
        boolean allText = true;
        boolean keyword = false;
        for (String cell : first) {
            String value = cell.trim();
            if (value.isEmpty() || NUMERIC.matcher(value).matches()) {
                if (!value.isEmpty()) {
                    return false;
                }
                allText = false;
                continue;
            }
            String lower = value.toLowerCase(Locale.ROOT);
            for (String word : HEADER_WORDS) {
                if (lower.contains(word)) {
                    keyword = true;
                    break;
                }
            }
        }
        return keyword || allText;
    }

    static String tableKind(ContentTable table) {
        for (List<String> row : table.getRows()) {
            for (String cell : row) {
                String lower = cell.toLowerCase(Locale.ROOT);
                for (String word : FINANCIAL_TABLE_WORDS) {
                    if (lower.contains(word)) {
                        return "financial";
                    }
                }
            }
        }
        if (table.getColumnCount() == 1) {
            return "list";
        }
        if (table.getColumnCount() == 2) {
            boolean labelled = true;
            for (List<String> row : table.getRows()) {
                String label = row.isEmpty() ? "" : row.get(0).trim();
                if (NUMERIC.matcher(label).matches()) {
                    labelled = false;
                    break;
                }
            }
            if (labelled) {
                return "form";
            }
        }
        return "grid";
    }

    private Map<String, Object> formatFeatures(ExtractedContent content) {
        Map<String, Object> features = new LinkedHashMap<>();
        switch (content.getFormat()) {
            case PDF:
                copy(content, features, "embedded_images", "encrypted", "ocr_applied");
                features.put("page_count", content.getPageCount());
                break;
            case EXCEL:
                copy(content, features, "merged_cells", "sheet_count");
                break;
            case WORD:
                copy(content, features, "embedded_images", "paragraph_count");
                features.put("has_headers", !content.getHeaders().isEmpty());
                features.put("has_footers", !content.getFooters().isEmpty());
                break;
            case IMAGE:
                copy(content, features, "width", "height", "ocr_applied");
                break;
            default:
                break;
        }
        return features;
    }

    private static void copy(ExtractedContent content, Map<String, Object> target, String... keys) {
        for (String key : keys) {
            Object value = content.getProperty(key);
            if (value != null) {
                target.put(key, value);
            }
        }
    }

    static List<String> findAll(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find() && found.size() < MAX_EXTRACTED_VALUES) {
            found.add(matcher.group().trim());
        }
        return new ArrayList<>(found);
    }

    static Map<String, Boolean> analyzeMargins(Collection<String> lines) {
        String text = String.join("\n", lines);
        Map<String, Boolean> patterns = new LinkedHashMap<>();
        patterns.put("page_number", PAGE_NUMBER.matcher(text).find());
        patterns.put("date", DATE_LABEL.matcher(text).find() || DATE.matcher(text).find());
        patterns.put("confidential", CONFIDENTIAL.matcher(text).find());
        patterns.put("copyright", COPYRIGHT.matcher(text).find());
        patterns.put("contact_info", CONTACT.matcher(text).find());
        return patterns;
    }
}
