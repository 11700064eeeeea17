package com.nosota.tripfund.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param tripId     Trip UUID
 * @param userId     User ID
 * @param userOwes   Shares of expenses other people paid
 * @param userIsOwed What others owe on expenses this user paid
 */
public record UserBalanceResponse(
        UUID tripId,
        String userId,
        BigDecimal userOwes,
        BigDecimal userIsOwed
) {
}
