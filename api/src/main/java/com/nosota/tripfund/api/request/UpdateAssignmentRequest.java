package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record UpdateAssignmentRequest(
        @NotNull(message = "Share amount is required")
        @PositiveOrZero(message = "Share amount must be non-negative")
        BigDecimal shareAmount
) {
}
