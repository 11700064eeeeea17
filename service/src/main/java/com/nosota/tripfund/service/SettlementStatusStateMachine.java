package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.SettlementStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating SettlementStatus transitions.
 *
 * <p>Payment recording moves a settlement between PENDING, PARTIALLY_PAID and PAID in
 * both directions (a deleted payment can undo progress). Only the creditor's
 * verification leaves that cycle, and VERIFIED is final.
 *
 * <p>State diagram:
 * <pre>
 *   PENDING ⇄ PARTIALLY_PAID ⇄ PAID ──verify──▶ VERIFIED
 *      ▲                        │
 *      └────────────────────────┘
 * </pre>
 */
@Component
public class SettlementStatusStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<SettlementStatus, Set<SettlementStatus>> ALLOWED_TRANSITIONS = Map.of(
            SettlementStatus.PENDING, EnumSet.of(
                    SettlementStatus.PARTIALLY_PAID,
                    SettlementStatus.PAID
            ),
            SettlementStatus.PARTIALLY_PAID, EnumSet.of(
                    SettlementStatus.PENDING,
                    SettlementStatus.PAID
            ),
            SettlementStatus.PAID, EnumSet.of(
                    SettlementStatus.PENDING,
                    SettlementStatus.PARTIALLY_PAID,
                    SettlementStatus.VERIFIED
            )
            // VERIFIED is final
    );

    /**
     * Validates if a status transition is allowed. Staying in the same status is always allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(SettlementStatus fromStatus, SettlementStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        if (fromStatus == toStatus) {
            return true;
        }
        Set<SettlementStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(SettlementStatus fromStatus, SettlementStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid settlement status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    public boolean isFinalState(SettlementStatus status) {
        return status == SettlementStatus.VERIFIED;
    }
}
