package com.example.clubadmin.domain;

public enum ReimbursementMethod {
    CHECK("Check"),
    BANK_TRANSFER("Bank transfer");

    private final String label;

    ReimbursementMethod(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
