package com.nosota.tripfund.scheduler;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.dto.SpendWindowResult;
import com.nosota.tripfund.service.SpendWindowService;
import com.nosota.tripfund.service.TimelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Scheduled job that closes spend windows whose milestone date has passed.
 *
 * <p>Configuration:
 * <pre>
 * timeline:
 *   spend-window:
 *     auto-close:
 *       enabled: true                  # enable/disable scheduler
 *       cron: "0 *&#47;15 * * * *"        # every 15 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "timeline.spend-window.auto-close.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SpendWindowScheduler {

    private final TimelineService timelineService;
    private final SpendWindowService spendWindowService;

    /**
     * Closes every OPEN trip whose "Spending Window Closes" milestone is due.
     *
     * <p>Each trip is closed in its own transaction; a failing trip is logged and skipped.
     */
    @Scheduled(cron = "${timeline.spend-window.auto-close.cron:0 */15 * * * *}")
    public void closeDueSpendWindows() {
        log.debug("Starting scheduled job: close due spend windows");

        List<UUID> tripIds = timelineService.findTripsWithDueSpendWindow();
        if (tripIds.isEmpty()) {
            log.debug("No due spend windows found");
            return;
        }

        int closed = 0;
        for (UUID tripId : tripIds) {
            try {
                SpendWindowResult result = spendWindowService.applySpendStatus(
                        tripId, SpendStatus.CLOSED, MilestoneTriggerType.AUTOMATIC);
                closed++;
                log.info("Auto-closed spend window of trip {}: {} settlements", tripId, result.settlementCount());
            } catch (Exception e) {
                log.error("Failed to auto-close spend window of trip {}: {}", tripId, e.getMessage(), e);
            }
        }
        log.info("Closed {} of {} due spend windows", closed, tripIds.size());
    }
}
