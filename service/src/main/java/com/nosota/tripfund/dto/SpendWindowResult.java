package com.nosota.tripfund.dto;

import com.nosota.tripfund.api.model.SpendStatus;

import java.util.UUID;

/**
 * Outcome of a spend window transition.
 *
 * @param tripId          Trip UUID
 * @param spendStatus     Status after the transition
 * @param settlementCount Settlements present after the transition (0 when OPEN)
 */
public record SpendWindowResult(
        UUID tripId,
        SpendStatus spendStatus,
        int settlementCount
) {
}
