package com.nosota.tripfund.dto;

import com.nosota.tripfund.api.model.SplitType;

import java.math.BigDecimal;

/**
 * Cost assignment as seen by the balance aggregator.
 */
public record LedgerAssignment(
        ParticipantRef user,
        BigDecimal shareAmount,
        BigDecimal normalizedShareAmount,
        SplitType splitType
) {
}
