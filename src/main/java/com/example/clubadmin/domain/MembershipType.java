package com.example.clubadmin.domain;

import java.util.Locale;

/**
 * Membership plans. {@link #NONE} only exists as a filter value.
 */
public enum MembershipType {
    SINGLE,
    FAMILY,
    LIFETIME,
    NONE;

    public String getLabel() {
        return this == NONE
                ? "No Active Membership"
                : name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }

    /** Lenient parse of form values such as "single" or "FAMILY"; null when blank or unknown. */
    public static MembershipType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return MembershipType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
