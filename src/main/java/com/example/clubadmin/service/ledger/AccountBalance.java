package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.LedgerAccount;

import java.math.BigDecimal;

public record AccountBalance(LedgerAccount account, BigDecimal balance) {
}
