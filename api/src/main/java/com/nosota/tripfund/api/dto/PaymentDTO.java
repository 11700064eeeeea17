package com.nosota.tripfund.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A payment recorded against a settlement.
 *
 * @param id               Payment UUID
 * @param settlementId     Settlement UUID
 * @param amount           Amount in the trip base currency
 * @param paidAt           When the money changed hands
 * @param paymentMethod    e.g. "Cash", "Bank Transfer"
 * @param paymentReference External reference, e.g. a bank transaction ID
 * @param notes            Free text
 * @param recordedById     User who recorded the payment
 * @param createdAt        When the payment was recorded
 */
public record PaymentDTO(
        UUID id,
        UUID settlementId,
        BigDecimal amount,
        LocalDateTime paidAt,
        String paymentMethod,
        String paymentReference,
        String notes,
        String recordedById,
        LocalDateTime createdAt
) {
}
