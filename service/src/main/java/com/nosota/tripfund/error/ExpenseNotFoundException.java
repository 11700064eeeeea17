package com.nosota.tripfund.error;

import java.util.UUID;

public class ExpenseNotFoundException extends Exception {
    public ExpenseNotFoundException(UUID expenseId) {
        super("Expense not found: " + expenseId);
    }

    public ExpenseNotFoundException(String message) {
        super(message);
    }
}
