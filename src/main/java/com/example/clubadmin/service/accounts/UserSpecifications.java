package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.*;
import jakarta.persistence.criteria.*;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Criteria building blocks for the admin user list.
 */
final class UserSpecifications {

    private UserSpecifications() {
    }

    static Specification<User> matching(UserSearchCriteria c) {
        return Specification.where(stateFilter(c))
                .and(search(c.query()))
                .and(in("role", c.roles()))
                .and(in("boardPosition", c.boardPositions()))
                .and(membership(c));
    }

    /** Deleted users only appear when the state filter names DELETED. */
    private static Specification<User> stateFilter(UserSearchCriteria c) {
        if (c.states().isEmpty()) {
            return (root, q, cb) -> cb.notEqual(root.get("state"), UserState.DELETED);
        }
        return (root, q, cb) -> root.get("state").in(c.states());
    }

    /** Case-insensitive substring over email and names; plain substring over the phone number. */
    static Specification<User> search(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String like = "%" + escape(raw.trim().toLowerCase(Locale.ROOT)) + "%";
        String phoneLike = "%" + escape(raw.trim()) + "%";
        return (root, q, cb) -> cb.or(
                cb.like(cb.lower(root.get("email")), like, '\\'),
                cb.like(cb.lower(root.get("firstName")), like, '\\'),
                cb.like(cb.lower(root.get("lastName")), like, '\\'),
                cb.like(root.get("phoneNumber"), phoneLike, '\\'));
    }

    private static <T> Specification<User> in(String attribute, java.util.Set<T> values) {
        if (values.isEmpty()) {
            return null;
        }
        return (root, q, cb) -> root.get(attribute).in(values);
    }

    /**
     * A user's effective plan is LIFETIME when awarded, otherwise the most expensive
     * active subscription (FAMILY over SINGLE), otherwise NONE.
     */
    private static Specification<User> membership(UserSearchCriteria c) {
        if (c.membershipTypes().isEmpty()) {
            return null;
        }
        return (root, query, cb) -> {
            Path<Object> lifetime = root.get("lifetimeMembershipAwardedAt");
            List<Predicate> any = new ArrayList<>();
            for (MembershipType type : c.membershipTypes()) {
                switch (type) {
                    case LIFETIME -> any.add(cb.isNotNull(lifetime));
                    case FAMILY -> any.add(cb.and(cb.isNull(lifetime),
                            cb.exists(activeSubscription(root, query, cb, MembershipType.FAMILY))));
                    case SINGLE -> any.add(cb.and(cb.isNull(lifetime),
                            cb.exists(activeSubscription(root, query, cb, MembershipType.SINGLE)),
                            cb.not(cb.exists(activeSubscription(root, query, cb, MembershipType.FAMILY)))));
                    case NONE -> any.add(cb.and(cb.isNull(lifetime),
                            cb.not(cb.exists(activeSubscription(root, query, cb, null)))));
                }
            }
            return cb.or(any.toArray(new Predicate[0]));
        };
    }

    private static Subquery<Long> activeSubscription(Root<User> user, CriteriaQuery<?> query,
                                                     CriteriaBuilder cb, MembershipType type) {
        Subquery<Long> sub = query.subquery(Long.class);
        Root<Subscription> s = sub.from(Subscription.class);
        List<Predicate> where = new ArrayList<>();
        where.add(cb.equal(s.get("user"), user));
        where.add(s.get("status").in(MembershipService.ACTIVE_STATUSES));
        if (type != null) {
            where.add(cb.equal(s.get("membershipType"), type));
        }
        sub.select(s.get("id")).where(where.toArray(new Predicate[0]));
        return sub;
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
