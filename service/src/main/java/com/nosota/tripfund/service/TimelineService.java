package com.nosota.tripfund.service;

import com.nosota.tripfund.api.dto.TimelineItemDTO;
import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.TripNotFoundException;
import com.nosota.tripfund.mapper.TripMapper;
import com.nosota.tripfund.model.TimelineItem;
import com.nosota.tripfund.model.Trip;
import com.nosota.tripfund.model.TripMember;
import com.nosota.tripfund.repository.TimelineItemRepository;
import com.nosota.tripfund.repository.TripMemberRepository;
import com.nosota.tripfund.repository.TripRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Trip milestones.
 *
 * <p>Default milestones seeded on trip creation:
 * <pre>
 *   0 Trip Created            now (completed)
 *   1 RSVP Deadline           start - 14d, or now + 30d
 *   3 Trip Starts             start (only with a start date)
 *   4 Trip Ends               end (only with an end date)
 *   5 Spending Window Closes  end + 3d, or now + 60d
 *   6 Settlement Deadline     end + 14d, or now + 74d
 * </pre>
 *
 * <p>Toggling "Spending Window Closes" closes or reopens the spend window through
 * {@link SpendWindowService}, exactly like the explicit spend-status action.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimelineService {

    private final TimelineItemRepository timelineItemRepository;
    private final TripRepository tripRepository;
    private final TripMemberRepository tripMemberRepository;
    private final SpendWindowService spendWindowService;
    private final Clock clock;

    /**
     * Creates the default milestones of a new trip.
     */
    public List<TimelineItem> seedDefaultMilestones(Trip trip) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate start = trip.getStartDate();
        LocalDate end = trip.getEndDate();

        List<TimelineItem> items = new ArrayList<>();
        TimelineItem created = newItem(trip.getId(), TimelineItem.TRIP_CREATED, "Trip planning has begun", now, 0);
        created.setCompleted(true);
        created.setCompletedAt(now);
        created.setFirstCompletedAt(now);
        items.add(created);

        items.add(newItem(trip.getId(), TimelineItem.RSVP_DEADLINE, "All invitees should confirm attendance",
                start != null ? start.atStartOfDay().minusDays(14) : now.plusDays(30), 1));
        if (start != null) {
            items.add(newItem(trip.getId(), TimelineItem.TRIP_STARTS, "The trip begins!", start.atStartOfDay(), 3));
        }
        if (end != null) {
            items.add(newItem(trip.getId(), TimelineItem.TRIP_ENDS, "The trip concludes", end.atStartOfDay(), 4));
        }
        items.add(newItem(trip.getId(), TimelineItem.SPENDING_WINDOW_CLOSES, "Finalize all expenses",
                end != null ? end.atStartOfDay().plusDays(3) : now.plusDays(60), 5));
        items.add(newItem(trip.getId(), TimelineItem.SETTLEMENT_DEADLINE, "All payments should be completed",
                end != null ? end.atStartOfDay().plusDays(14) : now.plusDays(74), 6));

        log.debug("Seeding {} milestones for trip {}", items.size(), trip.getId());
        return timelineItemRepository.saveAll(items);
    }

    public List<TimelineItemDTO> getTimeline(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        findTrip(tripId);
        if (actingUserId == null
                || !tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, actingUserId)) {
            throw new ForbiddenOperationException("You are not a member of this trip");
        }
        return TripMapper.INSTANCE.toTimelineDTOList(
                timelineItemRepository.findByTripIdAndDeletedAtIsNullOrderBySortOrderAscDateAsc(tripId));
    }

    /**
     * Toggles completion of a milestone. Organizers only.
     *
     * <p>For "Spending Window Closes" the spend window follows the new state: completing it
     * closes spending and materializes settlements, un-completing it reopens spending.
     */
    @Transactional(rollbackOn = Exception.class)
    public TimelineItemDTO toggleMilestone(UUID tripId, UUID itemId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        findTrip(tripId);
        TripMemberRole role = tripMemberRepository.findByTripIdAndUserIdAndDeletedAtIsNull(tripId, actingUserId)
                .map(TripMember::getRole)
                .orElse(null);
        if (role == null || !role.isOrganizer()) {
            throw new ForbiddenOperationException("Only trip organizers can toggle milestones");
        }

        TimelineItem item = timelineItemRepository.findByIdAndTripIdAndDeletedAtIsNull(itemId, tripId)
                .orElseThrow(() -> new EntityNotFoundException("Timeline item not found: " + itemId));
        boolean completing = !item.isCompleted();

        if (TimelineItem.SPENDING_WINDOW_CLOSES.equals(item.getTitle())) {
            // the lifecycle updates this milestone itself
            spendWindowService.applySpendStatus(tripId,
                    completing ? SpendStatus.CLOSED : SpendStatus.OPEN, MilestoneTriggerType.MANUAL);
        } else {
            LocalDateTime now = LocalDateTime.now(clock);
            item.setCompleted(completing);
            item.setCompletedAt(completing ? now : null);
            item.setTriggerType(completing ? MilestoneTriggerType.MANUAL : null);
            if (completing && item.getFirstCompletedAt() == null) {
                item.setFirstCompletedAt(now);
            }
            timelineItemRepository.save(item);
        }

        log.info("{} milestone '{}' of trip {} by {}",
                completing ? "Completed" : "Uncompleted", item.getTitle(), tripId, actingUserId);
        return TripMapper.INSTANCE.toDTO(item);
    }

    /**
     * Trips whose "Spending Window Closes" milestone is due while spending is still OPEN
     * and the milestone has never been completed.
     */
    public List<UUID> findTripsWithDueSpendWindow() {
        return timelineItemRepository.findTripIdsWithDueMilestone(
                TimelineItem.SPENDING_WINDOW_CLOSES, SpendStatus.OPEN, LocalDateTime.now(clock));
    }

    private Trip findTrip(UUID tripId) throws TripNotFoundException {
        return tripRepository.findByIdAndDeletedAtIsNull(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
    }

    private TimelineItem newItem(UUID tripId, String title, String description, LocalDateTime date, int order) {
        TimelineItem item = new TimelineItem();
        item.setTripId(tripId);
        item.setTitle(title);
        item.setDescription(description);
        item.setDate(date);
        item.setSortOrder(order);
        item.setCompleted(false);
        item.setCreatedAt(LocalDateTime.now(clock));
        return item;
    }
}
