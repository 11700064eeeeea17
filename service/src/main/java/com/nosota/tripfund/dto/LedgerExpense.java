package com.nosota.tripfund.dto;

import com.nosota.tripfund.api.model.ExpenseStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a non-deleted expense with its assignments, input of the balance aggregator.
 *
 * @param id               Expense UUID
 * @param amount           Amount in the expense currency
 * @param currency         Expense currency
 * @param fxRate           Rate to the trip's base currency
 * @param normalizedAmount Amount in the trip's base currency
 * @param date             Expense date, used for debt age
 * @param status           OPEN or CLOSED; both are aggregated
 * @param paidBy           Payer
 * @param categoryId       Optional category
 * @param assignments      Cost assignments
 */
@Builder
public record LedgerExpense(
        UUID id,
        BigDecimal amount,
        String currency,
        BigDecimal fxRate,
        BigDecimal normalizedAmount,
        LocalDateTime date,
        ExpenseStatus status,
        ParticipantRef paidBy,
        String categoryId,
        List<LedgerAssignment> assignments
) {
}
