package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request for creating a trip. The caller becomes its OWNER.
 *
 * @param name         Trip name
 * @param description  Optional description
 * @param baseCurrency ISO 4217 code all expenses are normalized to
 * @param startDate    Optional first day of the trip
 * @param endDate      Optional last day of the trip
 */
public record CreateTripRequest(
        @NotBlank(message = "Trip name is required")
        @Size(max = 200, message = "Trip name must be at most 200 characters")
        String name,

        String description,

        @NotBlank(message = "Base currency is required")
        @Pattern(regexp = "[A-Za-z]{3}", message = "Base currency must be a 3-letter ISO code")
        String baseCurrency,

        LocalDate startDate,

        LocalDate endDate
) {
}
