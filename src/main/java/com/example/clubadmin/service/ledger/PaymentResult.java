package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.LedgerEntry;
import com.example.clubadmin.domain.LedgerTransaction;
import com.example.clubadmin.domain.Payment;

import java.util.List;

public record PaymentResult(Payment payment, LedgerTransaction transaction, List<LedgerEntry> entries) {
}
