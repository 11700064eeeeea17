package com.nosota.tripfund.dto;

import com.nosota.tripfund.api.model.SpendStatus;

import java.util.UUID;

public record TripSnapshot(
        UUID id,
        String baseCurrency,
        SpendStatus spendStatus
) {
}
