package com.docclassifier.processing.strategy;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Order(2)
public class HealthcareStrategy extends KeywordIndustryStrategy {

    public static final String INDUSTRY = "healthcare";

    public HealthcareStrategy() {
        super(INDUSTRY, keywordTable(), Map.of());
    }

    private static Map<String, List<String>> keywordTable() {
        Map<String, List<String>> table = table();
        table.put("medical_record", List.of(
                "patient history", "vital signs", "medical record number", "chief complaint",
                "diagnosis", "treatment plan", "allergies", "medications", "physical examination",
                "medical history", "family history", "social history"));
        table.put("prescription", List.of(
                "rx", "prescribe", "dosage", "refill", "pharmacy", "sig", "dispense", "prescription",
                "medication", "take as directed", "tablets", "capsules"));
        table.put("lab_report", List.of(
                "lab results", "test date", "reference range", "specimen", "laboratory", "collected",
                "test name", "values", "units", "normal range", "analysis", "methodology"));
        table.put("medical_bill", List.of(
                "amount due", "service date", "billing code", "charges", "insurance", "payment",
                "cpt code", "provider", "itemized charges", "adjustment", "balance", "due date"));
        table.put("insurance_claim", List.of(
                "claim number", "policy number", "coverage", "insured", "benefits", "authorization",
                "provider", "diagnosis code", "icd code", "subscriber", "group number",
                "pre-authorization"));
        table.put("medical_imaging", List.of(
                "radiology", "imaging", "scan", "x-ray", "mri", "ct scan", "ultrasound", "impression",
                "technique", "contrast", "findings", "comparison"));
        table.put("discharge_summary", List.of(
                "discharge date", "admission date", "hospital course", "follow up",
                "discharge diagnosis", "medications", "condition", "disposition", "follow-up care",
                "discharge instructions", "admission diagnosis", "hospital stay"));
        table.put("vaccination_record", List.of(
                "vaccine", "immunization", "dose", "vaccination date", "lot number", "administered",
                "next due date", "manufacturer", "injection site", "vaccine type", "immunity",
                "booster"));
        return table;
    }
}
