package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.RsvpStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Membership of a user in a trip.
 *
 * <p>RSVP state is informational only; balance math includes everyone with
 * recorded expenses or assignments regardless of RSVP.
 */
@Entity
@Table(name = "trip_member")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class TripMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 10)
    private TripMemberRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "rsvp_status", nullable = false, length = 10)
    private RsvpStatus rsvpStatus;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
