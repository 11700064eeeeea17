package com.nosota.tripfund.dto;

import java.util.List;
import java.util.UUID;

/**
 * All expenses of a trip, oldest first.
 */
public record TripLedger(
        UUID tripId,
        String baseCurrency,
        List<LedgerExpense> expenses
) {
}
