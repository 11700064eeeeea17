package com.nosota.tripfund.api.response;

import com.nosota.tripfund.api.model.SpendStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * @param id           Trip UUID
 * @param name         Trip name
 * @param description  Optional description
 * @param baseCurrency ISO 4217 code all expenses are normalized to
 * @param startDate    Optional first day
 * @param endDate      Optional last day
 * @param spendStatus  OPEN or CLOSED
 * @param createdById  User who created the trip
 * @param createdAt    Creation timestamp
 */
public record TripResponse(
        UUID id,
        String name,
        String description,
        String baseCurrency,
        LocalDate startDate,
        LocalDate endDate,
        SpendStatus spendStatus,
        String createdById,
        LocalDateTime createdAt
) {
}
