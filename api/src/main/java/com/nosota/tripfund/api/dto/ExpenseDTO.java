package com.nosota.tripfund.api.dto;

import com.nosota.tripfund.api.model.ExpenseStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Expense with its cost assignments.
 *
 * @param id                 Expense UUID
 * @param tripId             Trip UUID
 * @param description        Free text description
 * @param amount             Amount in the expense currency
 * @param currency           ISO 4217 code of the expense
 * @param fxRate             Rate to the trip base currency
 * @param normalizedAmount   amount × fxRate
 * @param date               When the money was spent
 * @param status             OPEN or CLOSED
 * @param paidBy             User who fronted the money
 * @param categoryId         Optional category reference
 * @param notes              Optional notes
 * @param assignments        Cost assignments
 * @param assignedPercentage Share of the amount covered by assignments (0-100, one decimal)
 * @param createdAt          Creation timestamp
 * @param updatedAt          Last modification timestamp
 */
public record ExpenseDTO(
        UUID id,
        UUID tripId,
        String description,
        BigDecimal amount,
        String currency,
        BigDecimal fxRate,
        BigDecimal normalizedAmount,
        LocalDateTime date,
        ExpenseStatus status,
        UserSummaryDTO paidBy,
        String categoryId,
        String notes,
        List<CostAssignmentDTO> assignments,
        BigDecimal assignedPercentage,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
