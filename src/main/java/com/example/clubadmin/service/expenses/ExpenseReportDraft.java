package com.example.clubadmin.service.expenses;

import com.example.clubadmin.domain.ExpenseReportStatus;
import com.example.clubadmin.domain.ReimbursementMethod;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A member's report as entered; {@code status} null means submit.
 */
@Builder
public record ExpenseReportDraft(
        String purpose,
        ReimbursementMethod reimbursementMethod,
        ExpenseReportStatus status,
        Long bankAccountId,
        boolean certificationAccepted,
        List<Expense> expenses,
        List<Income> incomes) {

    public ExpenseReportDraft {
        expenses = expenses == null ? List.of() : List.copyOf(expenses);
        incomes = incomes == null ? List.of() : List.copyOf(incomes);
    }

    public ExpenseReportStatus effectiveStatus() {
        return status == null ? ExpenseReportStatus.SUBMITTED : status;
    }

    public record Expense(LocalDate date, String vendor, String description, BigDecimal amount, String receiptPath) {
    }

    public record Income(LocalDate date, String description, BigDecimal amount, String proofPath) {
    }
}
