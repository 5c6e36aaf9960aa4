package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.*;
import com.example.clubadmin.repository.SignupApplicationRepository;
import com.example.clubadmin.repository.UserEventRepository;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.service.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Admin side of user management: listing, application review and edits.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class UserAdminService {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 200;
    public static final Set<String> SORTABLE = Set.of("email", "firstName", "lastName", "state", "role");

    private final UserRepository userRepository;
    private final SignupApplicationRepository applicationRepository;
    private final UserEventRepository eventRepository;
    private final MembershipService membershipService;
    private final MemberNotifier notifier;

    /* ───────── listing ───────── */

    /**
     * @param page 1-based
     * @param size clamped to 1..{@value #MAX_PAGE_SIZE}; non-positive means {@value #DEFAULT_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public Page<UserRow> list(UserSearchCriteria criteria, int page, int size, String sort, String direction) {
        Pageable pageable = pageRequest(page, size, sort, direction);
        Page<User> users = userRepository.findAll(UserSpecifications.matching(criteria), pageable);
        Map<Long, MembershipType> memberships = membershipService.effectiveTypes(users.getContent());
        return users.map(u -> new UserRow(u, memberships.getOrDefault(u.getId(), MembershipType.NONE)));
    }

    static Pageable pageRequest(int page, int size, String sort, String direction) {
        int effectiveSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        String property = sort != null && SORTABLE.contains(sort) ? sort : "email";
        Sort.Direction dir = "desc".equalsIgnoreCase(direction) ? Sort.Direction.DESC : Sort.Direction.ASC;
        return PageRequest.of(Math.max(page, 1) - 1, effectiveSize, Sort.by(dir, property).and(Sort.by("id")));
    }

    @Transactional(readOnly = true)
    public User get(Long id) {
        return userRepository.findById(id).orElseThrow(() -> new NotFoundException("User", id));
    }

    @Transactional(readOnly = true)
    public Optional<SignupApplication> application(Long userId) {
        return applicationRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<UserEvent> events(Long userId) {
        return eventRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /* ───────── application review ───────── */

    public User approve(Long userId, User reviewer) {
        return review(userId, reviewer, ReviewOutcome.APPROVED);
    }

    public User reject(Long userId, User reviewer) {
        return review(userId, reviewer, ReviewOutcome.REJECTED);
    }

    private User review(Long userId, User reviewer, ReviewOutcome outcome) {
        User user = get(userId);
        SignupApplication application = applicationRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("No signup application for user " + userId));
        if (application.isReviewed()) {
            throw new IllegalStateException("Application was already reviewed");
        }

        UserState before = user.getState();
        UserState after = outcome == ReviewOutcome.APPROVED ? UserState.ACTIVE : UserState.REJECTED;
        user.setState(after);
        if (outcome == ReviewOutcome.APPROVED && application.getBirthDate() != null) {
            user.setDateOfBirth(application.getBirthDate());
        }

        application.setReviewOutcome(outcome);
        application.setReviewedAt(LocalDateTime.now());
        application.setReviewedBy(reviewer);
        eventRepository.save(UserEvent.stateUpdate(user, reviewer, before, after));

        if (outcome == ReviewOutcome.APPROVED) {
            notifier.applicationApproved(user);
        } else {
            notifier.applicationRejected(user);
        }
        log.info("Application of user {} {} by {}", userId,
                outcome.name().toLowerCase(Locale.ROOT), reviewer == null ? "system" : reviewer.getId());
        return user;
    }

    /* ───────── edit ───────── */

    public User update(Long userId, UserUpdate update, User actor) {
        User user = get(userId);
        String email = update.email() == null ? null : update.email().trim().toLowerCase(Locale.ROOT);
        if (email != null && !email.equalsIgnoreCase(user.getEmail())
                && userRepository.existsByEmailIgnoreCase(email)) {
            throw new IllegalArgumentException("email has already been taken");
        }

        UserState before = user.getState();
        user.setFirstName(update.firstName());
        user.setLastName(update.lastName());
        if (email != null) user.setEmail(email);
        user.setPhoneNumber(blankToNull(update.phoneNumber()));
        if (update.role() != null) user.setRole(update.role());
        if (update.state() != null) user.setState(update.state());
        user.setBoardPosition(update.boardPosition());

        Address incoming = update.billingAddress();
        if (incoming != null) {
            Address address = user.getBillingAddress() == null ? new Address() : user.getBillingAddress();
            address.setLine1(incoming.getLine1());
            address.setLine2(incoming.getLine2());
            address.setCity(incoming.getCity());
            address.setRegion(incoming.getRegion());
            address.setPostalCode(incoming.getPostalCode());
            address.setCountry(incoming.getCountry());
            user.setBillingAddress(address);
        }

        if (before != user.getState()) {
            eventRepository.save(UserEvent.stateUpdate(user, actor, before, user.getState()));
        }
        log.info("User {} updated by {}", userId, actor == null ? "system" : actor.getId());
        return user;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
