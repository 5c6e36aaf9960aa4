package com.example.clubadmin.service.ledger;

import com.example.clubadmin.domain.BookingProperty;
import com.example.clubadmin.domain.EntityType;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Inputs of {@link LedgerService#processPayment}. {@code processorFee} and {@code property} are optional.
 */
@Builder
public record PaymentRequest(Long userId,
                             BigDecimal amount,
                             EntityType entityType,
                             String entityId,
                             String externalPaymentId,
                             BigDecimal processorFee,
                             String description,
                             BookingProperty property) {
}
