package com.example.clubadmin.service.accounts;

import com.example.clubadmin.config.ClubProperties;
import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.Subscription;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.SubscriptionRepository;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.service.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Membership plan, period and lifetime award for one user.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class MembershipService {

    /** Subscription statuses that make a membership current. */
    public static final Set<String> ACTIVE_STATUSES = Set.of("active", "trialing");

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionGateway gateway;
    private final ClubProperties properties;

    @Transactional(readOnly = true)
    public Optional<Subscription> activeSubscription(Long userId) {
        return subscriptionRepository.findFirstByUserIdAndStatusInOrderByCreatedAtDesc(userId, ACTIVE_STATUSES);
    }

    /**
     * LIFETIME when awarded, else the most expensive active plan, else NONE.
     */
    @Transactional(readOnly = true)
    public MembershipType effectiveType(User user) {
        if (user.hasLifetimeMembership()) {
            return MembershipType.LIFETIME;
        }
        List<Subscription> active = subscriptionRepository
                .findByUserIdInAndStatusIn(List.of(user.getId()), ACTIVE_STATUSES);
        return pickMostExpensive(active);
    }

    /** Effective plan for a page of users in one query. */
    @Transactional(readOnly = true)
    public Map<Long, MembershipType> effectiveTypes(Collection<User> users) {
        Map<Long, List<Subscription>> byUser = new HashMap<>();
        if (!users.isEmpty()) {
            List<Long> ids = users.stream().map(User::getId).toList();
            for (Subscription s : subscriptionRepository.findByUserIdInAndStatusIn(ids, ACTIVE_STATUSES)) {
                byUser.computeIfAbsent(s.getUser().getId(), k -> new ArrayList<>()).add(s);
            }
        }
        Map<Long, MembershipType> result = new HashMap<>();
        for (User u : users) {
            result.put(u.getId(), u.hasLifetimeMembership()
                    ? MembershipType.LIFETIME
                    : pickMostExpensive(byUser.getOrDefault(u.getId(), List.of())));
        }
        return result;
    }

    /**
     * @return the confirmation message; "User is already on that membership plan" when nothing changed
     * @throws IllegalArgumentException for a missing or unknown selection
     * @throws IllegalStateException when the user has no active subscription
     */
    public String changeMembershipType(Long userId, String requestedType) {
        Subscription subscription = activeSubscription(userId)
                .orElseThrow(() -> new IllegalStateException("User does not have an active subscription to change"));
        if (requestedType == null || requestedType.isBlank()) {
            throw new IllegalArgumentException("Please select a membership type");
        }
        MembershipType target = MembershipType.parse(requestedType);
        ClubProperties.Plan newPlan = target == null ? null : properties.getPlans().get(target.name());
        if (newPlan == null || newPlan.getPriceId() == null) {
            throw new IllegalArgumentException("Invalid membership type selected");
        }
        MembershipType current = subscription.getMembershipType();
        if (current == target) {
            return "User is already on that membership plan";
        }
        ClubProperties.Plan currentPlan = properties.getPlans().get(current.name());
        if (currentPlan == null) {
            throw new IllegalStateException("Could not determine current membership plan");
        }
        SubscriptionGateway.Direction direction = newPlan.getAmount().compareTo(currentPlan.getAmount()) > 0
                ? SubscriptionGateway.Direction.UPGRADE
                : SubscriptionGateway.Direction.DOWNGRADE;
        gateway.changePlan(subscription, newPlan.getPriceId(), direction);
        log.info("User {} membership {} -> {} ({})", userId, current, target, direction);
        return "Membership type changed from " + current.getLabel() + " to " + target.getLabel();
    }

    /**
     * @param periodEnd ISO date ({@code 2025-06-30}) or date-time
     */
    public Subscription updateMembershipPeriod(Long userId, String periodEnd) {
        Subscription subscription = activeSubscription(userId)
                .orElseThrow(() -> new IllegalStateException("No active subscription found"));
        LocalDateTime end = parseDateTime(periodEnd)
                .orElseThrow(() -> new IllegalArgumentException("Invalid date format"));
        return gateway.updatePeriodEnd(subscription, end);
    }

    /**
     * Awards (with {@code awardedAt}, now when it does not parse) or revokes lifetime membership.
     * Awarding cancels a running single/family subscription so the member is no longer billed.
     *
     * @return the confirmation message
     */
    public String updateLifetimeMembership(Long userId, boolean award, String awardedAt) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
        if (!award) {
            user.setLifetimeMembershipAwardedAt(null);
            log.info("Lifetime membership revoked for user {}", userId);
            return "Lifetime membership revoked";
        }
        user.setLifetimeMembershipAwardedAt(parseDateTime(awardedAt).orElseGet(LocalDateTime::now));
        log.info("Lifetime membership awarded to user {}", userId);

        Optional<Subscription> active = activeSubscription(userId)
                .filter(s -> s.getMembershipType() == MembershipType.SINGLE
                        || s.getMembershipType() == MembershipType.FAMILY);
        if (active.isEmpty()) {
            return "Lifetime membership awarded";
        }
        try {
            gateway.cancel(active.get());
            return "Lifetime membership awarded and active subscription cancelled in Stripe";
        } catch (RuntimeException ex) {
            // award stands even when the processor refuses the cancellation
            log.warn("Failed to cancel subscription {} when awarding lifetime membership to user {}",
                    active.get().getId(), userId, ex);
            return "Lifetime membership awarded";
        }
    }

    private MembershipType pickMostExpensive(List<Subscription> active) {
        return active.stream()
                .map(Subscription::getMembershipType)
                .max(Comparator.comparing(this::planAmount))
                .orElse(MembershipType.NONE);
    }

    private BigDecimal planAmount(MembershipType type) {
        ClubProperties.Plan plan = properties.getPlans().get(type.name());
        return plan == null ? BigDecimal.ZERO : plan.getAmount();
    }

    static Optional<LocalDateTime> parseDateTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String s = raw.trim();
        try {
            return Optional.of(s.length() <= 10 ? LocalDate.parse(s).atStartOfDay() : LocalDateTime.parse(s));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
