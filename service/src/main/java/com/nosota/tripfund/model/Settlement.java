package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.SettlementStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Settlement entity - a planned transfer from a debtor to a creditor of a trip.
 *
 * <p>Settlements exist only while the trip's spend window is CLOSED. Every close
 * deletes all of the trip's settlements and recreates them from the current
 * expenses; reopening deletes them. They are never patched in place.
 *
 * <p>Example:
 * <pre>
 * Trip in EUR, Bob owes Alice 50.00 since 2024-03-15:
 *   fromUserId=bob, toUserId=alice, amount=50.00, currency=EUR,
 *   status=PENDING, notes="Debt since 2024-03-15"
 * </pre>
 */
@Entity
@Table(name = "settlement")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Settlement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    /**
     * Debtor.
     */
    @Column(name = "from_user_id", nullable = false, length = 128)
    private String fromUserId;

    /**
     * Creditor.
     */
    @Column(name = "to_user_id", nullable = false, length = 128)
    private String toUserId;

    /**
     * Transfer amount in the trip's base currency, rounded to the currency's minor unit.
     */
    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SettlementStatus status;

    /**
     * Position of the transfer in the plan it was created from.
     */
    @Column(name = "plan_order", nullable = false)
    private Integer planOrder;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
