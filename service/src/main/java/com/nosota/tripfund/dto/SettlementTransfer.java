package com.nosota.tripfund.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Planned transfer. The amount is unrounded; rounding happens when it is presented or persisted.
 *
 * @param from           Debtor
 * @param to             Creditor
 * @param amount         Amount in base currency
 * @param oldestDebtDate Date of the oldest expense that created the debt, null if unknown
 */
public record SettlementTransfer(
        ParticipantRef from,
        ParticipantRef to,
        BigDecimal amount,
        LocalDateTime oldestDebtDate
) {
}
