package com.nosota.tripfund.api.request;

import com.nosota.tripfund.api.model.RsvpStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import jakarta.validation.constraints.NotBlank;

/**
 * @param userId     User to add
 * @param role       Defaults to MEMBER
 * @param rsvpStatus Defaults to PENDING
 */
public record AddMemberRequest(
        @NotBlank(message = "User ID is required")
        String userId,

        TripMemberRole role,

        RsvpStatus rsvpStatus
) {
}
