package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Partial update of a payment; null fields are left unchanged.
 */
public record UpdatePaymentRequest(
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
