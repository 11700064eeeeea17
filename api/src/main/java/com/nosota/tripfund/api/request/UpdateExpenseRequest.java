package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Partial update of an expense; null fields are left unchanged.
 */
public record UpdateExpenseRequest(
        @Size(min = 1, max = 500, message = "Description must be between 1 and 500 characters")
        String description,

        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @Pattern(regexp = "[A-Za-z]{3}", message = "Currency must be a 3-letter ISO code")
        String currency,

        @Positive(message = "FX rate must be positive")
        BigDecimal fxRate,

        LocalDateTime date,

        String categoryId,

        String notes
) {
}
