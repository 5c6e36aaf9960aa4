package com.example.clubadmin.util;

import org.jsoup.Jsoup;
import org.jsoup.safety.Safelist;

/**
 * Post body cleanup on top of jsoup.
 */
public final class HtmlSanitizer {

    private static final Safelist POST_BODY = Safelist.relaxed()
            .addAttributes("a", "target", "rel")
            .addAttributes("img", "loading")
            .addProtocols("img", "src", "http", "https", "data");

    private HtmlSanitizer() {
    }

    public static String sanitize(String html) {
        if (html == null || html.isBlank()) {
            return html;
        }
        return Jsoup.clean(html, POST_BODY);
    }

    /** Plain text of the body, collapsed and cut at a word boundary near {@code maxLength}. */
    public static String previewText(String html, int maxLength) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
        if (text.length() <= maxLength) {
            return text;
        }
        int cut = text.lastIndexOf(' ', maxLength - 1);
        if (cut < maxLength / 2) {
            cut = maxLength - 1;
        }
        return text.substring(0, cut).trim() + "…";
    }
}
