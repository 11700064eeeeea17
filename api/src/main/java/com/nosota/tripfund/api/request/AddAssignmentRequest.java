package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Adds a single assignee with an exact share in the expense currency.
 */
public record AddAssignmentRequest(
        @NotBlank(message = "User ID is required")
        String userId,

        @NotNull(message = "Share amount is required")
        @PositiveOrZero(message = "Share amount must be non-negative")
        BigDecimal shareAmount
) {
}
