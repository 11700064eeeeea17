package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.ExpenseStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Expense entity - money one member fronted on behalf of the trip.
 *
 * <p>Amounts:
 * <ul>
 *   <li>{@code amount} - in the expense's own currency</li>
 *   <li>{@code fxRate} - conversion rate to the trip's base currency</li>
 *   <li>{@code normalizedAmount} - amount × fxRate, recomputed on every amount/fxRate change</li>
 * </ul>
 */
@Entity
@Table(name = "expense")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Expense {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "amount", nullable = false, precision = 19, scale = 6)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "fx_rate", nullable = false, precision = 19, scale = 8)
    private BigDecimal fxRate;

    @Column(name = "normalized_amount", nullable = false, precision = 19, scale = 6)
    private BigDecimal normalizedAmount;

    @Column(name = "expense_date", nullable = false)
    private LocalDateTime date;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private ExpenseStatus status = ExpenseStatus.OPEN;

    /**
     * User who paid for the expense.
     */
    @Column(name = "paid_by_id", nullable = false, length = 128)
    private String paidById;

    @Column(name = "category_id", length = 64)
    private String categoryId;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
