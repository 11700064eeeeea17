package com.nosota.tripfund.repository;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.dto.LedgerExpense;
import com.nosota.tripfund.dto.SettlementDraft;
import com.nosota.tripfund.dto.TripSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence capabilities the settlement engine depends on.
 *
 * <p>Implementations hide soft deletion: deleted trips, members and expenses are never
 * returned by any method here, so callers never filter on their own.
 *
 * <p>All methods are expected to run inside the caller's transaction.
 */
public interface TripLedgerStore {

    /**
     * Reads a trip without locking it.
     */
    Optional<TripSnapshot> findActiveTrip(UUID tripId);

    /**
     * Reads a trip and holds an exclusive lock on it until the transaction ends.
     */
    Optional<TripSnapshot> lockTrip(UUID tripId);

    Optional<TripMemberRole> findMemberRole(UUID tripId, String userId);

    /**
     * Non-deleted expenses of the trip with payer and assignment details, oldest first.
     */
    List<LedgerExpense> listExpenses(UUID tripId);

    /**
     * Deletes every settlement of the trip (with its payments) and inserts the drafts
     * as PENDING settlements, preserving their order.
     *
     * @return Number of inserted settlements
     */
    int replaceSettlements(UUID tripId, List<SettlementDraft> drafts);

    /**
     * Deletes every settlement of the trip with its payments.
     *
     * @return Number of deleted settlements
     */
    int deleteSettlements(UUID tripId);

    void setSpendStatus(UUID tripId, SpendStatus spendStatus);

    /**
     * Marks the "Spending Window Closes" milestone completed or not. No-op if the trip has none.
     */
    void syncSpendWindowMilestone(UUID tripId, boolean completed, MilestoneTriggerType triggerType);
}
