package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Request for recording an expense on a trip.
 *
 * @param description Free text description
 * @param amount      Amount in the expense currency (must be positive)
 * @param currency    ISO 4217 code of the expense
 * @param fxRate      Rate to the trip base currency, defaults to 1
 * @param date        When the money was spent, defaults to now
 * @param paidById    Payer, defaults to the caller
 * @param categoryId  Optional category reference
 * @param notes       Optional notes
 */
public record CreateExpenseRequest(
        @NotBlank(message = "Description is required")
        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotBlank(message = "Currency is required")
        @Pattern(regexp = "[A-Za-z]{3}", message = "Currency must be a 3-letter ISO code")
        String currency,

        @Positive(message = "FX rate must be positive")
        BigDecimal fxRate,

        LocalDateTime date,

        String paidById,

        String categoryId,

        String notes
) {
}
