package com.example.clubadmin.domain;

public enum ReviewOutcome {
    APPROVED,
    REJECTED
}
