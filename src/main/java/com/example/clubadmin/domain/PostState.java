package com.example.clubadmin.domain;

public enum PostState {
    DRAFT("Draft", "yellow"),
    PUBLISHED("Published", "green"),
    DELETED("Deleted", "red");

    private final String label;
    private final String badge;

    PostState(String label, String badge) {
        this.label = label;
        this.badge = badge;
    }

    public String getLabel() { return label; }

    public String badge() { return badge; }
}
