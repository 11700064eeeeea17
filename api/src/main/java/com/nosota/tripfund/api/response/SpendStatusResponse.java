package com.nosota.tripfund.api.response;

import com.nosota.tripfund.api.model.SpendStatus;

import java.util.UUID;

/**
 * Result of closing or reopening a trip's spend window.
 *
 * @param tripId          Trip UUID
 * @param spendStatus     Status after the transition
 * @param settlementCount Settlement records that now exist for the trip (0 when OPEN)
 * @param message         Human readable summary
 */
public record SpendStatusResponse(
        UUID tripId,
        SpendStatus spendStatus,
        int settlementCount,
        String message
) {
}
