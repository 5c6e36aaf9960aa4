package com.example.clubadmin.service.ledger;

import com.example.clubadmin.config.CacheConfig;
import com.example.clubadmin.domain.LedgerAccount;
import com.example.clubadmin.domain.LedgerAccountType;
import com.example.clubadmin.repository.LedgerAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * The fixed chart of accounts and name → id lookups over it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerAccountCatalog {

    public static final String CASH = "cash";
    public static final String STRIPE_ACCOUNT = "stripe_account";
    public static final String ACCOUNTS_RECEIVABLE = "accounts_receivable";
    public static final String MEMBERSHIP_REVENUE = "membership_revenue";
    public static final String EVENT_REVENUE = "event_revenue";
    public static final String BOOKING_REVENUE = "booking_revenue";
    public static final String DONATION_REVENUE = "donation_revenue";
    public static final String STRIPE_FEES = "stripe_fees";
    public static final String REFUND_EXPENSE = "refund_expense";

    record Definition(String name, LedgerAccountType type, String description) {
    }

    static final List<Definition> BASIC_ACCOUNTS = List.of(
            new Definition(CASH, LedgerAccountType.ASSET, "Cash account for holding funds"),
            new Definition(STRIPE_ACCOUNT, LedgerAccountType.ASSET, "Stripe account balance"),
            new Definition(ACCOUNTS_RECEIVABLE, LedgerAccountType.ASSET, "Outstanding payments from customers"),
            new Definition("accounts_payable", LedgerAccountType.LIABILITY, "Outstanding payments to vendors"),
            new Definition("deferred_revenue", LedgerAccountType.LIABILITY, "Prepaid subscriptions and bookings"),
            new Definition("refund_liability", LedgerAccountType.LIABILITY, "Pending refunds"),
            new Definition(MEMBERSHIP_REVENUE, LedgerAccountType.REVENUE, "Revenue from membership subscriptions"),
            new Definition(EVENT_REVENUE, LedgerAccountType.REVENUE, "Revenue from event registrations"),
            new Definition(BOOKING_REVENUE, LedgerAccountType.REVENUE, "Revenue from cabin bookings"),
            new Definition("tahoe_booking_revenue", LedgerAccountType.REVENUE, "Revenue from Tahoe cabin bookings"),
            new Definition("clear_lake_booking_revenue", LedgerAccountType.REVENUE, "Revenue from Clear Lake cabin bookings"),
            new Definition(DONATION_REVENUE, LedgerAccountType.REVENUE, "Revenue from donations"),
            new Definition(STRIPE_FEES, LedgerAccountType.EXPENSE, "Stripe processing fees"),
            new Definition("operating_expenses", LedgerAccountType.EXPENSE, "General operating expenses"),
            new Definition(REFUND_EXPENSE, LedgerAccountType.EXPENSE, "Refunds issued to customers"));

    private final LedgerAccountRepository accounts;

    /** Creates whichever basic accounts are missing. Idempotent. */
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.LEDGER_ACCOUNTS, allEntries = true)
    public int ensureBasicAccounts() {
        int created = 0;
        for (Definition def : BASIC_ACCOUNTS) {
            if (accounts.findByName(def.name()).isEmpty()) {
                accounts.save(LedgerAccount.builder()
                        .name(def.name())
                        .accountType(def.type())
                        .description(def.description())
                        .build());
                created++;
            }
        }
        if (created > 0) {
            log.info("Created {} missing ledger accounts", created);
        }
        return created;
    }

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.LEDGER_ACCOUNTS, key = "#name")
    public Long idOf(String name) {
        return accounts.findByName(name)
                .map(LedgerAccount::getId)
                .orElseThrow(() -> new IllegalStateException("Ledger account missing: " + name));
    }
}
