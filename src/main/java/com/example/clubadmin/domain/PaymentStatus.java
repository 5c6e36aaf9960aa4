package com.example.clubadmin.domain;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    REFUNDED,
    FAILED
}
