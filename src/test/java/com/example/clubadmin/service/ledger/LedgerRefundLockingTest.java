package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.LedgerTransactionType;
import com.example.clubadmin.domain.Payment;
import com.example.clubadmin.domain.PaymentStatus;
import com.example.clubadmin.repository.*;
import com.example.clubadmin.util.ReferenceIdGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class LedgerRefundLockingTest {

    private PaymentRepository payments;
    private LedgerTransactionRepository transactions;
    private LedgerService ledger;

    @BeforeEach
    void setUp() {
        payments = mock(PaymentRepository.class);
        transactions = mock(LedgerTransactionRepository.class);
        ledger = new LedgerService(mock(LedgerAccountCatalog.class), mock(LedgerAccountRepository.class),
                mock(LedgerEntryRepository.class), transactions, payments, mock(UserRepository.class),
                mock(ReferenceIdGenerator.class), new SimpleMeterRegistry());
    }

    @Test
    void refundTotalIsReadAfterThePaymentRowIsLocked() {
        Payment payment = Payment.builder().id(5L).referenceId("PMT-240115-ABCDG")
                .amount(new BigDecimal("45.00")).status(PaymentStatus.COMPLETED).build();
        when(payments.findByIdForUpdate(5L)).thenReturn(Optional.of(payment));
        // a refund committed by another admin while this one waited on the lock
        when(transactions.sumByPaymentAndType(5L, LedgerTransactionType.REFUND)).thenReturn(new BigDecimal("45.00"));

        assertThatThrownBy(() -> ledger.processRefund(5L, new BigDecimal("45.00"), "Duplicate", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Refund of 45.00 exceeds refundable amount 0.00");

        InOrder order = inOrder(payments, transactions);
        order.verify(payments).findByIdForUpdate(5L);
        order.verify(transactions).sumByPaymentAndType(5L, LedgerTransactionType.REFUND);
        verify(payments, never()).findById(anyLong());
        verify(transactions, never()).save(any());
    }
}
