package com.nosota.tripfund.api.model;

/**
 * Role of a member within a trip.
 * OWNER and ADMIN are organizers and may close or reopen the spend window.
 */
public enum TripMemberRole {
    OWNER,
    ADMIN,
    MEMBER;

    public boolean isOrganizer() {
        return this == OWNER || this == ADMIN;
    }
}
