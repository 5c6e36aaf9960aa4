package com.example.clubadmin.domain;

public enum LedgerTransactionType {
    PAYMENT,
    REFUND,
    PAYOUT,
    ADJUSTMENT
}
