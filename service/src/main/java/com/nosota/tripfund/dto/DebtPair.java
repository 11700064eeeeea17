package com.nosota.tripfund.dto;

/**
 * Directed debtor → creditor relationship.
 */
public record DebtPair(
        String debtorId,
        String creditorId
) {
}
