package com.nosota.tripfund.api.model;

/**
 * Settlement status.
 * Tracks repayment progress of a planned debtor → creditor transfer.
 */
public enum SettlementStatus {
    /**
     * PENDING: settlement was created when the spend window closed, nothing paid yet.
     */
    PENDING,

    /**
     * PARTIALLY_PAID: at least one payment was recorded but the amount is not covered.
     */
    PARTIALLY_PAID,

    /**
     * PAID: recorded payments cover the settlement amount.
     */
    PAID,

    /**
     * VERIFIED: the creditor confirmed receipt of the money.
     * This is a final state.
     */
    VERIFIED
}
