package com.nosota.tripfund.repository;

import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.model.TimelineItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TimelineItemRepository extends JpaRepository<TimelineItem, UUID> {

    List<TimelineItem> findByTripIdAndDeletedAtIsNullOrderBySortOrderAscDateAsc(UUID tripId);

    Optional<TimelineItem> findByIdAndTripIdAndDeletedAtIsNull(UUID id, UUID tripId);

    Optional<TimelineItem> findFirstByTripIdAndTitleAndDeletedAtIsNull(UUID tripId, String title);

    /**
     * IDs of trips whose milestone with the given title is due and has never been completed
     * while the trip still has the given spend status. A milestone un-completed after
     * firing is skipped.
     *
     * @param title       Milestone title
     * @param spendStatus Spend status the trip must currently have
     * @param now         Due date cut-off
     * @return Trip IDs
     */
    @Query("SELECT DISTINCT i.tripId FROM TimelineItem i, Trip t " +
            "WHERE t.id = i.tripId AND t.deletedAt IS NULL AND t.spendStatus = :spendStatus " +
            "AND i.title = :title AND i.completed = false AND i.firstCompletedAt IS NULL " +
            "AND i.deletedAt IS NULL AND i.date <= :now")
    List<UUID> findTripIdsWithDueMilestone(@Param("title") String title,
                                           @Param("spendStatus") SpendStatus spendStatus,
                                           @Param("now") LocalDateTime now);
}
