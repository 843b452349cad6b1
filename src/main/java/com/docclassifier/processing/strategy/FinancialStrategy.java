package com.docclassifier.processing.strategy;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Order(1)
public class FinancialStrategy extends KeywordIndustryStrategy {

    public static final String INDUSTRY = "financial";

    public FinancialStrategy() {
        super(INDUSTRY, keywordTable(), Map.of());
    }

    private static Map<String, List<String>> keywordTable() {
        Map<String, List<String>> table = table();
        table.put("bank_statement", List.of(
                "statement", "balance", "account", "account number", "opening balance",
                "closing balance", "deposit", "withdrawal", "transaction history", "statement period"));
        table.put("credit_card_statement", List.of(
                "credit limit", "minimum payment", "statement balance", "apr", "credit card",
                "card number", "payment due date", "interest charges"));
        table.put("invoice", List.of(
                "invoice", "invoice number", "invoice date", "bill to", "payment terms",
                "due", "due date", "subtotal", "total", "total amount", "tax"));
        table.put("tax_return", List.of(
                "tax year", "taxable income", "deductions", "tax paid", "tax return",
                "social security", "filing status", "irs", "form 1040"));
        table.put("payroll", List.of(
                "salary", "wages", "deductions", "net pay", "gross pay", "pay period",
                "employee id", "payroll date"));
        table.put("loan_application", List.of(
                "loan amount", "interest rate", "term", "collateral", "borrower", "credit score",
                "monthly payment", "application date"));
        table.put("financial_report", List.of(
                "balance sheet", "income statement", "cash flow", "assets", "liabilities",
                "equity", "profit", "loss"));
        return table;
    }
}
