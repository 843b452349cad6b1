package com.docclassifier.shared.exception;

import com.docclassifier.shared.model.ErrorCode;

public class UnknownIndustryException extends ClassificationException {

    private final String industry;

    public UnknownIndustryException(String industry) {
        super(ErrorCode.UNKNOWN_INDUSTRY, "Unknown industry: " + industry);
        this.industry = industry;
    }

    public String getIndustry() {
        return industry;
    }
}
