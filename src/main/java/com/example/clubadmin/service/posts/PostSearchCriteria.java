package com.example.clubadmin.service.posts;

import com.example.clubadmin.domain.PostState;

import java.util.Set;

/**
 * Post list filters. No states means every state except DELETED.
 */
public record PostSearchCriteria(Set<PostState> states, Long authorId) {

    public PostSearchCriteria {
        states = states == null ? Set.of() : Set.copyOf(states);
    }
}
