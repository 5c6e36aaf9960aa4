package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.User;

/** One line of the admin user table. */
public record UserRow(User user, MembershipType membership) {
}
