package com.nosota.tripfund.api.response;

import com.nosota.tripfund.api.dto.PaymentDTO;
import com.nosota.tripfund.api.model.SettlementStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persisted settlement with its repayment progress.
 *
 * @param id              Settlement UUID
 * @param tripId          Trip UUID
 * @param fromUserId      Debtor
 * @param fromUserName    Debtor display name
 * @param toUserId        Creditor
 * @param toUserName      Creditor display name
 * @param amount          Amount in the trip base currency
 * @param currency        Trip base currency
 * @param status          PENDING, PARTIALLY_PAID, PAID or VERIFIED
 * @param notes           "Debt since ..." annotation, may be null
 * @param createdAt       When the spend window closed
 * @param totalPaid       Sum of recorded payments
 * @param remainingAmount amount - totalPaid
 * @param payments        Recorded payments, newest first
 */
public record SettlementResponse(
        UUID id,
        UUID tripId,
        String fromUserId,
        String fromUserName,
        String toUserId,
        String toUserName,
        BigDecimal amount,
        String currency,
        SettlementStatus status,
        String notes,
        LocalDateTime createdAt,
        BigDecimal totalPaid,
        BigDecimal remainingAmount,
        List<PaymentDTO> payments
) {
}
