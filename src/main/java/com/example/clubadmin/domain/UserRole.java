package com.example.clubadmin.domain;

public enum UserRole {
    MEMBER,
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
