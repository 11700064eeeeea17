package com.nosota.tripfund.dto;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Settlement row to be inserted when a spend window closes.
 */
@Builder
public record SettlementDraft(
        String fromUserId,
        String toUserId,
        BigDecimal amount,
        String currency,
        String notes
) {
}
