package com.nosota.tripfund.api.dto;

/**
 * Display fields of a user referenced from expenses, balances and members.
 *
 * @param id       User ID (identity provider uid)
 * @param name     Display name, falls back to email
 * @param email    Email address
 * @param photoURL Avatar URL, may be null
 */
public record UserSummaryDTO(
        String id,
        String name,
        String email,
        String photoURL
) {
}
