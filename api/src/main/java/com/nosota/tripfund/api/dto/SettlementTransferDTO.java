package com.nosota.tripfund.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One planned transfer of the minimal settlement plan.
 *
 * @param fromUserId     Debtor user ID
 * @param fromUserName   Debtor display name
 * @param toUserId       Creditor user ID
 * @param toUserName     Creditor display name
 * @param amount         Amount in base currency, rounded to the currency's minor unit
 * @param oldestDebtDate Date of the oldest expense where the debtor owed the creditor directly, may be null
 */
public record SettlementTransferDTO(
        String fromUserId,
        String fromUserName,
        String toUserId,
        String toUserName,
        BigDecimal amount,
        LocalDateTime oldestDebtDate
) {
}
