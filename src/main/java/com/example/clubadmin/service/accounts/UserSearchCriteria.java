package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import lombok.Builder;

import java.util.Set;

/**
 * Filters of the admin user list. Empty sets mean "no filter".
 */
@Builder
public record UserSearchCriteria(String query,
                                 Set<UserState> states,
                                 Set<UserRole> roles,
                                 Set<BoardPosition> boardPositions,
                                 Set<MembershipType> membershipTypes) {

    public UserSearchCriteria {
        states = states == null ? Set.of() : Set.copyOf(states);
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        boardPositions = boardPositions == null ? Set.of() : Set.copyOf(boardPositions);
        membershipTypes = membershipTypes == null ? Set.of() : Set.copyOf(membershipTypes);
    }

    public static UserSearchCriteria none() {
        return UserSearchCriteria.builder().build();
    }
}
