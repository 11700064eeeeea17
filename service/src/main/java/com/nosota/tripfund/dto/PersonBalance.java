package com.nosota.tripfund.dto;

import java.math.BigDecimal;

/**
 * Net position of one user in a trip, in the trip's base currency. Not rounded.
 *
 * @param user       Participant
 * @param totalPaid  Sum of normalized amounts of expenses the user paid
 * @param totalOwed  Sum of the user's normalized shares
 * @param netBalance totalPaid - totalOwed; positive means the user is owed money
 */
public record PersonBalance(
        ParticipantRef user,
        BigDecimal totalPaid,
        BigDecimal totalOwed,
        BigDecimal netBalance
) {
}
