package com.nosota.tripfund.api.model;

/**
 * Lifecycle status of a single expense.
 */
public enum ExpenseStatus {
    /**
     * OPEN: amount, items and cost assignments are editable.
     * Assignment totals may deviate from the expense amount.
     */
    OPEN,

    /**
     * CLOSED: expense has been finalized, assignments are locked.
     */
    CLOSED
}
