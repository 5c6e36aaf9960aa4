package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.*;
import com.example.clubadmin.repository.*;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.util.ReferenceIdGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Double-entry bookkeeping for payments, refunds, payouts and credits.
 *
 * <p>Entry amounts are signed: a debit is stored positive and a credit negative,
 * except revenue lines written by {@link #processPayment}, which are stored positive
 * so that revenue balances read as positive totals.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class LedgerService {

    public static final int RECENT_PAYMENTS_LIMIT = 50;

    private final LedgerAccountCatalog catalog;
    private final LedgerAccountRepository accountRepository;
    private final LedgerEntryRepository entryRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final ReferenceIdGenerator referenceIds;
    private final MeterRegistry meterRegistry;

    /* ───────── payments ───────── */

    public PaymentResult processPayment(PaymentRequest request) {
        requirePositive(request.amount());
        catalog.ensureBasicAccounts();

        User user = request.userId() == null ? null : userRepository.findById(request.userId())
                .orElseThrow(() -> new NotFoundException("User", request.userId()));

        Payment payment = paymentRepository.save(Payment.builder()
                .referenceId(referenceIds.generate("PMT"))
                .user(user)
                .amount(request.amount())
                .status(PaymentStatus.COMPLETED)
                .externalProvider("stripe")
                .externalPaymentId(request.externalPaymentId())
                .paymentDate(LocalDateTime.now())
                .build());

        LedgerTransaction tx = transactionRepository.save(LedgerTransaction.builder()
                .type(LedgerTransactionType.PAYMENT)
                .payment(payment)
                .totalAmount(request.amount())
                .build());

        EntityType entityType = request.entityType() == null ? EntityType.MEMBERSHIP : request.entityType();
        String description = request.description() == null ? "" : request.description();
        List<LedgerEntry> entries = new ArrayList<>();

        entries.add(entry(LedgerAccountCatalog.STRIPE_ACCOUNT, payment, tx, request.amount(),
                "Payment receivable from Stripe: " + description, entityType, request.entityId()));
        entries.add(entry(revenueAccountFor(entityType, request.property()), payment, tx, request.amount(),
                "Revenue from " + entityType.value() + ": " + description, entityType, request.entityId()));

        BigDecimal fee = request.processorFee();
        if (fee != null && fee.signum() > 0) {
            String paymentId = String.valueOf(payment.getId());
            entries.add(entry(LedgerAccountCatalog.STRIPE_FEES, payment, tx, fee,
                    "Stripe processing fee for payment " + payment.getReferenceId(),
                    EntityType.ADMINISTRATION, paymentId));
            entries.add(entry(LedgerAccountCatalog.STRIPE_ACCOUNT, payment, tx, fee.negate(),
                    "Stripe fee deduction from receivable - " + payment.getReferenceId(),
                    EntityType.ADMINISTRATION, paymentId));
        }

        count(LedgerTransactionType.PAYMENT);
        log.info("Payment {} recorded: amount={} entityType={} entries={}",
                payment.getReferenceId(), request.amount(), entityType.value(), entries.size());
        return new PaymentResult(payment, tx, entries);
    }

    /* ───────── refunds ───────── */

    /**
     * Records a (possibly partial) refund of {@code paymentId}. The payment flips to
     * REFUNDED once the refunds add up to its amount.
     *
     * @throws IllegalArgumentException when the amount is not positive or exceeds what is left to refund
     */
    public LedgerTransaction processRefund(Long paymentId, BigDecimal amount, String reason, String externalRefundId) {
        requirePositive(amount);
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason can't be blank");
        }
        catalog.ensureBasicAccounts();

        // Held until commit so concurrent refunds of one payment see each other's totals.
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
        if (payment.getStatus() == PaymentStatus.REFUNDED) {
            throw new IllegalStateException("Payment " + payment.getReferenceId() + " is already fully refunded");
        }

        BigDecimal refunded = refundedAmount(paymentId);
        BigDecimal refundable = payment.getAmount().subtract(refunded);
        if (amount.compareTo(refundable) > 0) {
            throw new IllegalArgumentException("Refund of " + amount + " exceeds refundable amount " + refundable);
        }

        Optional<LedgerEntry> revenueEntry = entryRepository.findByPaymentWithAccount(paymentId).stream()
                .filter(e -> e.getAccount().getAccountType() == LedgerAccountType.REVENUE && e.getAmount().signum() > 0)
                .findFirst();

        LedgerTransaction tx = transactionRepository.save(LedgerTransaction.builder()
                .type(LedgerTransactionType.REFUND)
                .payment(payment)
                .totalAmount(amount)
                .referenceId(referenceIds.generate("RFD"))
                .reason(reason)
                .build());

        String paymentRef = String.valueOf(payment.getId());
        entry(LedgerAccountCatalog.REFUND_EXPENSE, payment, tx, amount,
                "Refund issued: " + reason, EntityType.ADMINISTRATION, paymentRef);
        entry(LedgerAccountCatalog.STRIPE_ACCOUNT, payment, tx, amount.negate(),
                "Refund processed through Stripe: " + reason, EntityType.ADMINISTRATION, paymentRef);
        revenueEntry.ifPresent(rev -> entryRepository.save(LedgerEntry.builder()
                .account(rev.getAccount())
                .payment(payment)
                .transaction(tx)
                .amount(amount.negate())
                .description("Revenue reversal for refund: " + reason)
                .relatedEntityType(EntityType.ADMINISTRATION)
                .relatedEntityId(paymentRef)
                .build()));

        if (refunded.add(amount).compareTo(payment.getAmount()) >= 0) {
            payment.setStatus(PaymentStatus.REFUNDED);
        }

        count(LedgerTransactionType.REFUND);
        log.info("Refund {} of {} recorded against payment {} (external {})",
                tx.getReferenceId(), amount, payment.getReferenceId(), externalRefundId);
        return tx;
    }

    @Transactional(readOnly = true)
    public BigDecimal refundedAmount(Long paymentId) {
        return transactionRepository.sumByPaymentAndType(paymentId, LedgerTransactionType.REFUND);
    }

    /* ───────── payouts ───────── */

    /** Processor payout: money moves from the processor balance to cash. */
    public PaymentResult processPayout(BigDecimal amount, String payoutId, String description) {
        requirePositive(amount);
        catalog.ensureBasicAccounts();

        Payment payment = paymentRepository.save(Payment.builder()
                .referenceId(referenceIds.generate("PMT"))
                .amount(amount)
                .status(PaymentStatus.COMPLETED)
                .externalProvider("stripe")
                .externalPaymentId(payoutId)
                .paymentDate(LocalDateTime.now())
                .build());
        LedgerTransaction tx = transactionRepository.save(LedgerTransaction.builder()
                .type(LedgerTransactionType.PAYOUT)
                .payment(payment)
                .totalAmount(amount)
                .build());

        String paymentRef = String.valueOf(payment.getId());
        List<LedgerEntry> entries = List.of(
                entry(LedgerAccountCatalog.CASH, payment, tx, amount,
                        "Stripe payout received: " + description, EntityType.ADMINISTRATION, paymentRef),
                entry(LedgerAccountCatalog.STRIPE_ACCOUNT, payment, tx, amount.negate(),
                        "Stripe payout processed: " + description, EntityType.ADMINISTRATION, paymentRef));

        count(LedgerTransactionType.PAYOUT);
        log.info("Payout {} of {} recorded", payoutId, amount);
        return new PaymentResult(payment, tx, entries);
    }

    /* ───────── credits ───────── */

    public PaymentResult addCredit(Long userId, BigDecimal amount, String reason,
                                   EntityType entityType, String entityId) {
        requirePositive(amount);
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason can't be blank");
        }
        catalog.ensureBasicAccounts();

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));

        Payment payment = paymentRepository.save(Payment.builder()
                .referenceId(referenceIds.generate("PMT"))
                .user(user)
                .amount(amount)
                .status(PaymentStatus.COMPLETED)
                .externalProvider("stripe")
                .externalPaymentId("credit_" + UUID.randomUUID())
                .paymentDate(LocalDateTime.now())
                .build());
        LedgerTransaction tx = transactionRepository.save(LedgerTransaction.builder()
                .type(LedgerTransactionType.ADJUSTMENT)
                .payment(payment)
                .totalAmount(amount)
                .reason(reason)
                .build());

        EntityType type = entityType == null ? EntityType.ADMINISTRATION : entityType;
        String relatedId = entityId == null || entityId.isBlank() ? String.valueOf(payment.getId()) : entityId;
        List<LedgerEntry> entries = List.of(
                entry(LedgerAccountCatalog.ACCOUNTS_RECEIVABLE, payment, tx, amount,
                        "Credit issued: " + reason, type, relatedId),
                entry(LedgerAccountCatalog.CASH, payment, tx, amount.negate(),
                        "Customer credit liability: " + reason, type, relatedId));

        count(LedgerTransactionType.ADJUSTMENT);
        log.info("Credit {} of {} added for user {}", payment.getReferenceId(), amount, userId);
        return new PaymentResult(payment, tx, entries);
    }

    /* ───────── queries ───────── */

    /**
     * Every account with the sum of its entries; with a range, only entries whose
     * payment is dated inside it count.
     */
    @Transactional(readOnly = true)
    public List<AccountBalance> accountsWithBalances(DateRange range) {
        List<Object[]> rows = range == null
                ? entryRepository.sumByAccount()
                : entryRepository.sumByAccountBetween(range.startTime(), range.endTime());
        Map<Long, BigDecimal> sums = new HashMap<>();
        for (Object[] row : rows) {
            sums.put(((Number) row[0]).longValue(), toBigDecimal(row[1]));
        }
        return accountRepository.findAll().stream()
                .sorted(Comparator.comparing(LedgerAccount::getAccountType).thenComparing(LedgerAccount::getName))
                .map(a -> new AccountBalance(a, sums.getOrDefault(a.getId(), BigDecimal.ZERO)))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentView> recentPayments(DateRange range) {
        Pageable limit = PageRequest.of(0, RECENT_PAYMENTS_LIMIT);
        List<Payment> payments = range == null
                ? paymentRepository.findRecent(limit)
                : paymentRepository.findRecent(range.startTime(), range.endTime(), limit);
        return withTypes(payments);
    }

    @Transactional(readOnly = true)
    public Page<PaymentView> userPayments(Long userId, int page, int perPage) {
        Pageable pageable = PageRequest.of(Math.max(page, 1) - 1, perPage);
        Page<Payment> payments = paymentRepository.findByUserIdOrderByPaymentDateDesc(userId, pageable);
        return new PageImpl<>(withTypes(payments.getContent()), pageable, payments.getTotalElements());
    }

    @Transactional(readOnly = true)
    public Payment getPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesFor(Long paymentId) {
        return entryRepository.findByPaymentWithAccount(paymentId);
    }

    private List<PaymentView> withTypes(List<Payment> payments) {
        if (payments.isEmpty()) {
            return List.of();
        }
        List<Long> ids = payments.stream().map(Payment::getId).toList();
        Map<Long, LedgerEntry> revenueByPayment = entryRepository
                .findPositiveByPaymentsAndAccountType(ids, LedgerAccountType.REVENUE).stream()
                .collect(Collectors.toMap(e -> e.getPayment().getId(), Function.identity(), (a, b) -> a));
        return payments.stream()
                .map(p -> describe(p, revenueByPayment.get(p.getId())))
                .toList();
    }

    static PaymentView describe(Payment payment, LedgerEntry revenueEntry) {
        if (revenueEntry == null || revenueEntry.getRelatedEntityType() == null) {
            return new PaymentView(payment, PaymentView.UNKNOWN, "Payment");
        }
        return switch (revenueEntry.getRelatedEntityType()) {
            case MEMBERSHIP -> new PaymentView(payment, "Membership", "Membership Payment");
            case EVENT -> new PaymentView(payment, "Event", "Event Tickets");
            case BOOKING -> new PaymentView(payment, "Booking", "Cabin Booking");
            case DONATION -> new PaymentView(payment, "Donation", "Donation");
            case ADMINISTRATION -> new PaymentView(payment, "Administration", "System transaction");
        };
    }

    /* ───────── helpers ───────── */

    private LedgerEntry entry(String accountName, Payment payment, LedgerTransaction tx, BigDecimal amount,
                              String description, EntityType type, String relatedId) {
        LedgerAccount account = accountRepository.getReferenceById(catalog.idOf(accountName));
        return entryRepository.save(LedgerEntry.builder()
                .account(account)
                .payment(payment)
                .transaction(tx)
                .amount(amount)
                .description(description)
                .relatedEntityType(type)
                .relatedEntityId(relatedId)
                .build());
    }

    private static String revenueAccountFor(EntityType type, BookingProperty property) {
        return switch (type) {
            case EVENT -> LedgerAccountCatalog.EVENT_REVENUE;
            case BOOKING -> property == null ? LedgerAccountCatalog.BOOKING_REVENUE : property.revenueAccount();
            case DONATION -> LedgerAccountCatalog.DONATION_REVENUE;
            default -> LedgerAccountCatalog.MEMBERSHIP_REVENUE;
        };
    }

    private static BigDecimal toBigDecimal(Object value) {
        return value instanceof BigDecimal bd ? bd : new BigDecimal(String.valueOf(value));
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("must be positive");
        }
    }

    private void count(LedgerTransactionType type) {
        meterRegistry.counter("club.ledger.transactions", "type", type.name().toLowerCase(Locale.ROOT)).increment();
    }
}
