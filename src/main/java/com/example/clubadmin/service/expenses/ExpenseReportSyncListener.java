package com.example.clubadmin.service.expenses;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExpenseReportSyncListener {

    private final AccountingSync accountingSync;

    @Async("taskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSubmitted(ExpenseReportSubmittedEvent event) {
        try {
            accountingSync.syncExpenseReport(event.expenseReportId());
        } catch (RuntimeException e) {
            log.error("Accounting sync failed for expense report {}", event.expenseReportId(), e);
        }
    }
}
