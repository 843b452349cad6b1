package com.docclassifier.processing.strategy;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Government-issued identity documents, usually arriving as scanned images.
 */
@Component
@Order(3)
public class IdentityStrategy extends KeywordIndustryStrategy {

    public static final String INDUSTRY = "identity";

    public IdentityStrategy() {
        super(INDUSTRY, keywordTable(), Map.of());
    }

    private static Map<String, List<String>> keywordTable() {
        Map<String, List<String>> table = table();
        table.put("drivers_license", List.of(
                "driver license", "driver's license", "drivers license", "driving licence",
                "license number", "dmv", "endorsements", "restrictions", "class", "expires",
                "date of birth", "dob"));
        table.put("passport", List.of(
                "passport", "passport number", "passport no", "nationality", "place of birth",
                "date of issue", "date of expiry", "surname", "given names", "issuing authority"));
        table.put("national_id", List.of(
                "national id", "identity card", "id number", "citizen", "personal number",
                "issuing country", "date of birth"));
        return table;
    }
}
