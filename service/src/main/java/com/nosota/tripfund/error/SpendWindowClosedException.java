package com.nosota.tripfund.error;

/**
 * Expense data was modified while the trip's spend window is CLOSED.
 */
public class SpendWindowClosedException extends Exception {
    public SpendWindowClosedException(String message) {
        super(message);
    }
}
