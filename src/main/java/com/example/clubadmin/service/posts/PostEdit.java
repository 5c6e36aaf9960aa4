package com.example.clubadmin.service.posts;

/**
 * Editable fields of a post as sent by the editor. Null means "not sent".
 */
public record PostEdit(String title,
                       String urlName,
                       String previewText,
                       String body,
                       Boolean featuredPost) {
}
