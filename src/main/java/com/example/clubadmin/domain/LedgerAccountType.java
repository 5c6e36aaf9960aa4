package com.example.clubadmin.domain;

public enum LedgerAccountType {
    ASSET,
    LIABILITY,
    REVENUE,
    EXPENSE
}
