package com.nosota.tripfund.api.dto;

import com.nosota.tripfund.api.model.MilestoneTriggerType;

import java.time.LocalDateTime;
import java.util.UUID;

public record TimelineItemDTO(
        UUID id,
        UUID tripId,
        String title,
        String description,
        LocalDateTime date,
        Integer sortOrder,
        boolean completed,
        LocalDateTime completedAt,
        MilestoneTriggerType triggerType
) {
}
