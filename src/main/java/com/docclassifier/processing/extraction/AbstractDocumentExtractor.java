package com.docclassifier.processing.extraction;

import com.docclassifier.processing.model.ExtractedContent;
import com.docclassifier.shared.exception.ExtractionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Shared guard rails for extractors: rejects empty input, converts decoder failures into
 * {@link ExtractionFailedException} and refuses to return content without usable text.
 */
public abstract class AbstractDocumentExtractor implements DocumentExtractor {

    static final int MIN_USABLE_CHARS = 3;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @Override
    public final ExtractedContent extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ExtractionFailedException("document is empty (0 bytes)");
        }

        ExtractedContent extracted;
        try {
            extracted = doExtract(content);
        } catch (ExtractionFailedException e) {
            logger.warn("{} rejected document: {}", name(), e.getReason());
            throw e;
        } catch (Exception e) {
            logger.warn("{} could not decode document: {}", name(), e.getMessage());
            throw new ExtractionFailedException(format() + " content could not be decoded: " + e.getMessage(), e);
        }

        if (!hasUsableText(extracted.getRawText())) {
            throw new ExtractionFailedException("no extractable text in " + format() + " document");
        }

        logger.debug("{} extracted {} chars, {} tables, pages={}", name(),
                extracted.getRawText().length(), extracted.getTables().size(), extracted.getPageCount());
        return extracted;
    }

    protected abstract ExtractedContent doExtract(byte[] content) throws Exception;

    /**
     * Strips control characters, collapses horizontal whitespace and trims every line.
     */
    protected static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        normalized = CONTROL_CHARS.matcher(normalized).replaceAll(" ");
        StringBuilder sb = new StringBuilder(normalized.length());
        for (String line : normalized.split("\n", -1)) {
            sb.append(HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim()).append('\n');
        }
        return BLANK_LINES.matcher(sb.toString()).replaceAll("\n\n").trim();
    }

    protected static boolean hasUsableText(String text) {
        return countAlphanumeric(text) >= MIN_USABLE_CHARS;
    }

    protected static int countAlphanumeric(String text) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetterOrDigit(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
