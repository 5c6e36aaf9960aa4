package com.example.clubadmin.service.media;

import com.example.clubadmin.domain.Image;

import java.util.List;

/**
 * One gallery page. {@code endOfTimeline} is set when the page is not full.
 */
public record MediaPage(List<Image> images, int page, int perPage, boolean endOfTimeline, long totalCount) {

    public boolean hasPrevious() {
        return page > 1;
    }

    public boolean hasNext() {
        return !endOfTimeline;
    }
}
