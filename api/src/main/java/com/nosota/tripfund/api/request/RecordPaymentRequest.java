package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Request for recording a payment towards a settlement.
 *
 * @param amount           Amount in the trip base currency (must be positive)
 * @param paidAt           When the money changed hands, defaults to now
 * @param paymentMethod    e.g. "Cash", "Bank Transfer"
 * @param paymentReference External reference
 * @param notes            Free text (max 500 characters)
 */
public record RecordPaymentRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        LocalDateTime paidAt,

        @Size(max = 100, message = "Payment method must be at most 100 characters")
        String paymentMethod,

        @Size(max = 200, message = "Payment reference must be at most 200 characters")
        String paymentReference,

        @Size(max = 500, message = "Notes must be at most 500 characters")
        String notes
) {
}
