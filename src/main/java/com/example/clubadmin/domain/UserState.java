package com.example.clubadmin.domain;

/**
 * Account lifecycle of a member.
 */
public enum UserState {
    PENDING_APPROVAL("Pending Approval"),
    ACTIVE("Active"),
    SUSPENDED("Suspended"),
    REJECTED("Rejected"),
    DELETED("Deleted");

    private final String label;

    UserState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Badge colour used by the admin tables. */
    public String badge() {
        return switch (this) {
            case ACTIVE -> "green";
            case PENDING_APPROVAL -> "yellow";
            case REJECTED, SUSPENDED -> "red";
            case DELETED -> "dark";
        };
    }
}
