package com.example.clubadmin.config;

import com.example.clubadmin.service.ledger.LedgerAccountCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the chart of ledger accounts on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataInitializer implements ApplicationRunner {

    private final LedgerAccountCatalog catalog;

    @Override
    public void run(ApplicationArguments args) {
        int created = catalog.ensureBasicAccounts();
        if (created > 0) {
            log.info("Created {} ledger account(s)", created);
        }
    }
}
