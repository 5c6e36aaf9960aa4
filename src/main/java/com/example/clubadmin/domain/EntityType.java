package com.example.clubadmin.domain;

import java.util.Locale;

/**
 * What a ledger entry relates to. Persisted lower-case by {@link EntityTypeConverter}.
 */
public enum EntityType {
    ADMINISTRATION,
    EVENT,
    MEMBERSHIP,
    BOOKING,
    DONATION;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntityType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("entity type is required");
        }
        for (EntityType t : values()) {
            if (t.value().equalsIgnoreCase(raw.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown entity type: " + raw);
    }
}
