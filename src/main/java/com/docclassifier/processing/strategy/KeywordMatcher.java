package com.docclassifier.processing.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts case-insensitive whole-word keyword occurrences. Words of a multi-word keyword match
 * across any run of whitespace, including line breaks.
 */
public final class KeywordMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private KeywordMatcher() {
    }

    public static int count(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword == null || keyword.isBlank()) {
            return 0;
        }
        Matcher matcher = patternFor(keyword).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static Pattern patternFor(String keyword) {
        return CACHE.computeIfAbsent(keyword.trim().toLowerCase(Locale.ROOT), key -> {
            StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
            String[] words = WHITESPACE.split(key);
            for (int i = 0; i < words.length; i++) {
                if (i > 0) {
                    regex.append("\\s+");
                }
                regex.append(Pattern.quote(words[i]));
            }
            regex.append("(?![\\p{L}\\p{N}])");
            return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        });
    }
}
