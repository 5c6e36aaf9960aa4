package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.Payment;

/**
 * A payment with its kind ("Membership", "Event", ...) derived from the revenue entry.
 */
public record PaymentView(Payment payment, String type, String description) {

    public static final String UNKNOWN = "Unknown";
}
