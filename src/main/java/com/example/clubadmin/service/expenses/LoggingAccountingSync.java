package com.example.clubadmin.service.expenses;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Leaves reports in {@code pending} and logs the hand-off. Replace with a real bookkeeping client.
 */
@Slf4j
@Component
public class LoggingAccountingSync implements AccountingSync {

    @Override
    public void syncExpenseReport(Long expenseReportId) {
        log.info("Expense report {} queued for accounting sync", expenseReportId);
    }
}
