package com.example.clubadmin.util;

import java.util.Locale;

public final class Slugs {

    public static final String UNTITLED = "new-untitled-post";

    private Slugs() {
    }

    /**
     * Whitespace runs become "-", then lower-case, then anything outside
     * {@code [0-9a-z-]} is dropped. A blank result becomes {@value #UNTITLED}.
     */
    public static String slugify(String title) {
        if (title == null) {
            return UNTITLED;
        }
        String slug = title.trim()
                .replaceAll("\\s+", "-")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^0-9a-z-]", "");
        return slug.isEmpty() ? UNTITLED : slug;
    }

    /** Appends {@code -(n+1)} when {@code existing} posts already use the slug family. */
    public static String disambiguate(String slug, long existing) {
        return existing > 0 ? slug + "-" + (existing + 1) : slug;
    }
}
