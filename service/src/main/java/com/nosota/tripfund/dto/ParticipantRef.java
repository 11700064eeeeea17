package com.nosota.tripfund.dto;

/**
 * Display fields of a user taking part in a trip's expenses.
 *
 * @param id       User ID
 * @param name     Display name (falls back to email)
 * @param email    Email
 * @param photoUrl Avatar URL, may be null
 */
public record ParticipantRef(
        String id,
        String name,
        String email,
        String photoUrl
) {
    public static ParticipantRef of(String id) {
        return new ParticipantRef(id, id, null, null);
    }
}
