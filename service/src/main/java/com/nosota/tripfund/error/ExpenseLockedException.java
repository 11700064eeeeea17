package com.nosota.tripfund.error;

/**
 * Expense is finalized (CLOSED); its amount and assignments can no longer change.
 */
public class ExpenseLockedException extends Exception {
    public ExpenseLockedException(String message) {
        super(message);
    }
}
