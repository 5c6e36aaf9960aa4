package com.example.clubadmin.domain;

public enum ExpenseReportStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED,
    PAID
}
