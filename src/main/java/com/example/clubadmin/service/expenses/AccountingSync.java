package com.example.clubadmin.service.expenses;

/**
 * Pushes submitted expense reports to the bookkeeping system.
 */
public interface AccountingSync {

    void syncExpenseReport(Long expenseReportId);
}
