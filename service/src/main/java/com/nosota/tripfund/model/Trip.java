package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.SpendStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Trip - the unit of expense settlement.
 *
 * <p>All expenses of a trip are normalized into its base currency. The spend status
 * gates expense changes and the existence of settlement records:
 * <pre>
 *   OPEN   - expenses editable, no settlements
 *   CLOSED - expenses frozen, settlements materialized
 * </pre>
 *
 * <p>The trip row doubles as the per-trip lock: lifecycle transitions and expense
 * mutations select it FOR UPDATE before touching anything else.
 */
@Entity
@Table(name = "trip")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Trip {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description")
    private String description;

    /**
     * Currency all balances and settlements are expressed in (ISO 4217 code).
     */
    @Column(name = "base_currency", nullable = false, length = 3)
    private String baseCurrency;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "spend_status", nullable = false, length = 10)
    private SpendStatus spendStatus = SpendStatus.OPEN;

    @Column(name = "created_by_id", nullable = false, length = 128)
    private String createdById;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * Soft-delete marker. Deleted trips are invisible to every query.
     */
    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
