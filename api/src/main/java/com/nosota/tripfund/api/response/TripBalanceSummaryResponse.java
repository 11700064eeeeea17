package com.nosota.tripfund.api.response;

import com.nosota.tripfund.api.dto.PersonBalanceDTO;
import com.nosota.tripfund.api.dto.SettlementTransferDTO;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Balances of every participant plus the minimal settlement plan.
 * Computed on every request, never cached.
 *
 * @param tripId       Trip UUID
 * @param baseCurrency ISO 4217 code of all amounts
 * @param totalSpent   Sum of normalized amounts of all expenses
 * @param balances     One entry per user who paid or was assigned a share
 * @param settlements  Planned transfers that zero out the balances
 * @param calculatedAt When the summary was computed
 */
public record TripBalanceSummaryResponse(
        UUID tripId,
        String baseCurrency,
        BigDecimal totalSpent,
        List<PersonBalanceDTO> balances,
        List<SettlementTransferDTO> settlements,
        LocalDateTime calculatedAt
) {
}
