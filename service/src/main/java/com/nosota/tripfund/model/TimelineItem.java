package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Trip milestone.
 *
 * <p>The {@value #SPENDING_WINDOW_CLOSES} milestone is bound to the trip's spend status:
 * it is completed exactly when the spend window is CLOSED. {@code firstCompletedAt} survives
 * un-completion, so a reopened window is never closed again by the scheduler.
 */
@Entity
@Table(name = "timeline_item")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TimelineItem {

    public static final String TRIP_CREATED = "Trip Created";
    public static final String RSVP_DEADLINE = "RSVP Deadline";
    public static final String TRIP_STARTS = "Trip Starts";
    public static final String TRIP_ENDS = "Trip Ends";
    public static final String SPENDING_WINDOW_CLOSES = "Spending Window Closes";
    public static final String SETTLEMENT_DEADLINE = "Settlement Deadline";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "item_date", nullable = false)
    private LocalDateTime date;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "first_completed_at")
    private LocalDateTime firstCompletedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", length = 10)
    private MilestoneTriggerType triggerType;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
