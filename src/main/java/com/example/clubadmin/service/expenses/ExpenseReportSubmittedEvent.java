package com.example.clubadmin.service.expenses;

public record ExpenseReportSubmittedEvent(Long expenseReportId, Long userId) {
}
