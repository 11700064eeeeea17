package com.nosota.tripfund.api.dto;

import com.nosota.tripfund.api.model.RsvpStatus;
import com.nosota.tripfund.api.model.TripMemberRole;

import java.time.LocalDateTime;

public record TripMemberDTO(
        String userId,
        String name,
        String email,
        TripMemberRole role,
        RsvpStatus rsvpStatus,
        LocalDateTime joinedAt
) {
}
