package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.Address;
import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import lombok.Builder;

/**
 * Admin edit of a user. A null {@code billingAddress} leaves the stored address untouched.
 */
@Builder
public record UserUpdate(String firstName,
                         String lastName,
                         String email,
                         String phoneNumber,
                         UserRole role,
                         UserState state,
                         BoardPosition boardPosition,
                         Address billingAddress) {
}
