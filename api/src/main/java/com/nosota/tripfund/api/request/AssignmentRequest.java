package com.nosota.tripfund.api.request;

import com.nosota.tripfund.api.model.SplitType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * One assignee of an expense split.
 *
 * @param userId     Assignee
 * @param splitType  EQUAL, PERCENTAGE, EXACT or SHARE
 * @param splitValue Ignored for EQUAL; percentage, exact amount or weight otherwise
 */
public record AssignmentRequest(
        @NotBlank(message = "User ID is required")
        String userId,

        @NotNull(message = "Split type is required")
        SplitType splitType,

        @PositiveOrZero(message = "Split value must be non-negative")
        BigDecimal splitValue
) {
}
