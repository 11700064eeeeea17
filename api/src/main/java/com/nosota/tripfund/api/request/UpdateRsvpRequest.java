package com.nosota.tripfund.api.request;

import com.nosota.tripfund.api.model.RsvpStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateRsvpRequest(
        @NotNull(message = "RSVP status is required")
        RsvpStatus rsvpStatus
) {
}
