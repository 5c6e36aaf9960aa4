package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.*;
import com.example.clubadmin.repository.LedgerAccountRepository;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.util.ReferenceIdGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({LedgerService.class, LedgerAccountCatalog.class, ReferenceIdGenerator.class,
        LedgerServiceTest.Metrics.class})
class LedgerServiceTest {

    @TestConfiguration
    static class Metrics {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired LedgerService ledger;
    @Autowired LedgerAccountCatalog catalog;
    @Autowired LedgerAccountRepository accounts;
    @Autowired UserRepository users;
    @Autowired MeterRegistry meterRegistry;

    private User member;

    @BeforeEach
    void setUp() {
        member = users.save(new User("jane@example.org", "jane", "doe"));
    }

    @Test
    void basicAccountsAreCreatedOnce() {
        int first = catalog.ensureBasicAccounts();
        int second = catalog.ensureBasicAccounts();

        assertThat(first).isEqualTo(LedgerAccountCatalog.BASIC_ACCOUNTS.size());
        assertThat(second).isZero();
        assertThat(accounts.count()).isEqualTo(LedgerAccountCatalog.BASIC_ACCOUNTS.size());
    }

    @Test
    void paymentWithFeeWritesFourEntries() {
        double paymentsBefore = meterRegistry.counter("club.ledger.transactions", "type", "payment").count();
        PaymentResult result = ledger.processPayment(PaymentRequest.builder()
                .userId(member.getId())
                .amount(new BigDecimal("100.00"))
                .entityType(EntityType.MEMBERSHIP)
                .entityId("sub_1")
                .externalPaymentId("pi_123")
                .processorFee(new BigDecimal("3.20"))
                .description("Annual dues")
                .build());

        assertThat(result.payment().getReferenceId()).startsWith("PMT-");
        assertThat(ReferenceIdGenerator.isValid(result.payment().getReferenceId())).isTrue();
        assertThat(result.payment().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(result.entries()).hasSize(4);

        Map<String, BigDecimal> balances = balances();
        assertThat(balances.get(LedgerAccountCatalog.STRIPE_ACCOUNT)).isEqualByComparingTo("96.80");
        assertThat(balances.get(LedgerAccountCatalog.MEMBERSHIP_REVENUE)).isEqualByComparingTo("100.00");
        assertThat(balances.get(LedgerAccountCatalog.STRIPE_FEES)).isEqualByComparingTo("3.20");
        assertThat(balances.get(LedgerAccountCatalog.CASH)).isEqualByComparingTo("0");

        assertThat(meterRegistry.counter("club.ledger.transactions", "type", "payment").count()).isEqualTo(paymentsBefore + 1);
    }

    @Test
    void bookingPaymentsGoToThePropertyRevenueAccount() {
        ledger.processPayment(PaymentRequest.builder()
                .userId(member.getId())
                .amount(new BigDecimal("250.00"))
                .entityType(EntityType.BOOKING)
                .property(BookingProperty.TAHOE)
                .description("Two nights")
                .build());

        assertThat(balances().get("tahoe_booking_revenue")).isEqualByComparingTo("250.00");
        assertThat(balances().get(LedgerAccountCatalog.BOOKING_REVENUE)).isEqualByComparingTo("0");
    }

    @Test
    void partialRefundsUntilFullyRefunded() {
        Payment payment = pay("100.00");

        LedgerTransaction first = ledger.processRefund(payment.getId(), new BigDecimal("40.00"), "Cancelled night", "re_1");
        assertThat(first.getType()).isEqualTo(LedgerTransactionType.REFUND);
        assertThat(first.getReferenceId()).startsWith("RFD-");
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(ledger.refundedAmount(payment.getId())).isEqualByComparingTo("40.00");

        assertThatThrownBy(() -> ledger.processRefund(payment.getId(), new BigDecimal("70.00"), "Too much", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds refundable amount");

        ledger.processRefund(payment.getId(), new BigDecimal("60.00"), "Rest", "re_2");
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);

        Map<String, BigDecimal> balances = balances();
        assertThat(balances.get(LedgerAccountCatalog.MEMBERSHIP_REVENUE)).isEqualByComparingTo("0");
        assertThat(balances.get(LedgerAccountCatalog.REFUND_EXPENSE)).isEqualByComparingTo("100.00");
        assertThat(balances.get(LedgerAccountCatalog.STRIPE_ACCOUNT)).isEqualByComparingTo("0");

        assertThatThrownBy(() -> ledger.processRefund(payment.getId(), new BigDecimal("1.00"), "Again", null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void refundNeedsPositiveAmountAndReason() {
        Payment payment = pay("10.00");

        assertThatThrownBy(() -> ledger.processRefund(payment.getId(), BigDecimal.ZERO, "x", null))
                .hasMessage("must be positive");
        assertThatThrownBy(() -> ledger.processRefund(payment.getId(), BigDecimal.ONE, " ", null))
                .hasMessage("reason can't be blank");
    }

    @Test
    void creditMovesCashToReceivable() {
        PaymentResult credit = ledger.addCredit(member.getId(), new BigDecimal("25.00"), "Goodwill",
                EntityType.ADMINISTRATION, null);

        assertThat(credit.transaction().getType()).isEqualTo(LedgerTransactionType.ADJUSTMENT);
        assertThat(credit.payment().getExternalPaymentId()).startsWith("credit_");
        Map<String, BigDecimal> balances = balances();
        assertThat(balances.get(LedgerAccountCatalog.ACCOUNTS_RECEIVABLE)).isEqualByComparingTo("25.00");
        assertThat(balances.get(LedgerAccountCatalog.CASH)).isEqualByComparingTo("-25.00");
    }

    @Test
    void payoutMovesProcessorBalanceToCash() {
        pay("80.00");
        ledger.processPayout(new BigDecimal("80.00"), "po_1", "weekly");

        Map<String, BigDecimal> balances = balances();
        assertThat(balances.get(LedgerAccountCatalog.CASH)).isEqualByComparingTo("80.00");
        assertThat(balances.get(LedgerAccountCatalog.STRIPE_ACCOUNT)).isEqualByComparingTo("0");
    }

    @Test
    void recentPaymentsAreLabelledByRevenueEntry() {
        ledger.processPayment(PaymentRequest.builder()
                .userId(member.getId())
                .amount(new BigDecimal("20.00"))
                .entityType(EntityType.DONATION)
                .build());

        List<PaymentView> recent = ledger.recentPayments(new DateRange(LocalDate.now().minusDays(1), LocalDate.now()));

        assertThat(recent).hasSize(1);
        assertThat(recent.get(0).type()).isEqualTo("Donation");
        assertThat(ledger.userPayments(member.getId(), 1, 20).getTotalElements()).isEqualTo(1);
    }

    private Payment pay(String amount) {
        return ledger.processPayment(PaymentRequest.builder()
                .userId(member.getId())
                .amount(new BigDecimal(amount))
                .entityType(EntityType.MEMBERSHIP)
                .description("dues")
                .build()).payment();
    }

    private Map<String, BigDecimal> balances() {
        return ledger.accountsWithBalances(null).stream()
                .collect(Collectors.toMap(b -> b.account().getName(), AccountBalance::balance));
    }
}
