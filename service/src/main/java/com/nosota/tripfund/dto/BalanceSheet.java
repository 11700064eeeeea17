package com.nosota.tripfund.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Output of the balance aggregator.
 *
 * @param tripId       Trip UUID
 * @param baseCurrency Trip base currency
 * @param totalSpent   Sum of normalized amounts of all expenses
 * @param balances     One entry per distinct payer or assignee, in first-appearance order
 * @param debtAges     Oldest expense date per debtor → creditor pair
 * @param calculatedAt Calculation time
 */
@Builder
public record BalanceSheet(
        UUID tripId,
        String baseCurrency,
        BigDecimal totalSpent,
        List<PersonBalance> balances,
        Map<DebtPair, LocalDateTime> debtAges,
        LocalDateTime calculatedAt
) {
}
