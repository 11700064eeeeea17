package com.nosota.tripfund.model;

import com.nosota.tripfund.api.model.SplitType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Share of an expense owed by one user.
 *
 * <p>{@code shareAmount} is in the expense currency; {@code normalizedShareAmount}
 * is shareAmount × expense.fxRate and is kept in sync when the rate changes.
 */
@Entity
@Table(name = "cost_assignment")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CostAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "expense_id", nullable = false)
    private UUID expenseId;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "share_amount", nullable = false, precision = 19, scale = 6)
    private BigDecimal shareAmount;

    @Column(name = "normalized_share_amount", nullable = false, precision = 19, scale = 6)
    private BigDecimal normalizedShareAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "split_type", nullable = false, length = 12)
    private SplitType splitType;

    /**
     * Input the share was derived from: a percentage, a number of shares or an exact amount.
     */
    @Column(name = "split_value", precision = 19, scale = 6)
    private BigDecimal splitValue;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
