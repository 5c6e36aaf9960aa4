package com.example.clubadmin.domain;

import java.util.Locale;

/** Stored renditions of an uploaded image, in tab order. */
public enum ImageVersion {
    OPTIMIZED,
    THUMBNAIL,
    RAW;

    public static ImageVersion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPTIMIZED;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return OPTIMIZED;
        }
    }
}
