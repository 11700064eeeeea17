package com.nosota.tripfund.api.dto;

import java.math.BigDecimal;

/**
 * Per-person balance in the trip's base currency.
 *
 * @param userId       User ID
 * @param userName     Display name (falls back to email)
 * @param userEmail    Email address
 * @param userPhotoURL Avatar URL, may be null
 * @param totalPaid    Sum of normalized amounts of expenses this user paid
 * @param totalOwed    Sum of normalized shares assigned to this user
 * @param netBalance   totalPaid - totalOwed; positive = is owed money, negative = owes money
 */
public record PersonBalanceDTO(
        String userId,
        String userName,
        String userEmail,
        String userPhotoURL,
        BigDecimal totalPaid,
        BigDecimal totalOwed,
        BigDecimal netBalance
) {
}
