package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.Money;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.SpendStatusAction;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.dto.*;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.TripNotFoundException;
import com.nosota.tripfund.repository.TripLedgerStore;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Opens and closes a trip's spend window and keeps settlement records in step with it.
 *
 * <p>State diagram:
 * <pre>
 *   OPEN ──close──▶ CLOSED   aggregate, plan, replace all settlements
 *   CLOSED ──open──▶ OPEN    delete all settlements
 *   CLOSED ──close──▶ CLOSED recompute, same result for unchanged expenses
 * </pre>
 *
 * <p>Every transition locks the trip row first, so it never interleaves with an expense
 * change of the same trip, and runs in a single transaction: a failure leaves both the
 * spend status and the settlement rows as they were. Settlements are never patched in
 * place.
 *
 * <p>The explicit spend-status endpoint, the "Spending Window Closes" milestone toggle
 * and the auto-close scheduler all go through {@link #applySpendStatus}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpendWindowService {

    private static final String DEBT_SINCE = "Debt since ";

    private final TripLedgerStore tripLedgerStore;
    private final BalanceAggregator balanceAggregator;
    private final SettlementPlanner settlementPlanner;

    /**
     * Closes, reopens or toggles the spend window on behalf of a trip organizer.
     *
     * @param tripId       Trip UUID
     * @param actingUserId Caller
     * @param action       CLOSE, OPEN or TOGGLE; null means TOGGLE
     * @return Resulting status and settlement count
     * @throws TripNotFoundException        if the trip is missing or deleted
     * @throws ForbiddenOperationException  if the caller is not an OWNER or ADMIN of the trip
     */
    @Transactional(rollbackOn = Exception.class)
    public SpendWindowResult changeSpendStatus(UUID tripId, String actingUserId, SpendStatusAction action)
            throws TripNotFoundException, ForbiddenOperationException {
        TripSnapshot trip = tripLedgerStore.lockTrip(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
        requireOrganizer(tripId, actingUserId);

        SpendStatusAction effective = action != null ? action : SpendStatusAction.TOGGLE;
        SpendStatus target = effective.resolve(trip.spendStatus());

        log.info("User {} requested spend status {} for trip {} (current={})",
                actingUserId, effective, tripId, trip.spendStatus());
        return transition(trip, target, MilestoneTriggerType.MANUAL);
    }

    /**
     * Moves the spend window to the target status without a permission check.
     * Callers are responsible for authorization.
     *
     * @param tripId      Trip UUID
     * @param target      Status to reach
     * @param triggerType How the change was triggered, recorded on the milestone
     * @return Resulting status and settlement count
     * @throws TripNotFoundException if the trip is missing or deleted
     */
    @Transactional(rollbackOn = Exception.class)
    public SpendWindowResult applySpendStatus(UUID tripId, SpendStatus target, MilestoneTriggerType triggerType)
            throws TripNotFoundException {
        TripSnapshot trip = tripLedgerStore.lockTrip(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
        return transition(trip, target, triggerType);
    }

    private SpendWindowResult transition(TripSnapshot trip, SpendStatus target, MilestoneTriggerType triggerType) {
        if (target == SpendStatus.CLOSED) {
            return close(trip, triggerType);
        }
        return reopen(trip, triggerType);
    }

    private SpendWindowResult close(TripSnapshot trip, MilestoneTriggerType triggerType) {
        List<LedgerExpense> expenses = tripLedgerStore.listExpenses(trip.id());
        BalanceSheet sheet = balanceAggregator.aggregate(new TripLedger(trip.id(), trip.baseCurrency(), expenses));
        List<SettlementTransfer> transfers = settlementPlanner.plan(sheet);

        List<SettlementDraft> drafts = toDrafts(transfers, trip.baseCurrency());
        int created = tripLedgerStore.replaceSettlements(trip.id(), drafts);

        tripLedgerStore.setSpendStatus(trip.id(), SpendStatus.CLOSED);
        tripLedgerStore.syncSpendWindowMilestone(trip.id(), true, triggerType);

        log.info("Spend window of trip {} closed ({}): {} expenses, {} settlements created",
                trip.id(), triggerType, expenses.size(), created);
        return new SpendWindowResult(trip.id(), SpendStatus.CLOSED, created);
    }

    private SpendWindowResult reopen(TripSnapshot trip, MilestoneTriggerType triggerType) {
        int deleted = tripLedgerStore.deleteSettlements(trip.id());

        tripLedgerStore.setSpendStatus(trip.id(), SpendStatus.OPEN);
        tripLedgerStore.syncSpendWindowMilestone(trip.id(), false, triggerType);

        log.info("Spend window of trip {} reopened ({}): {} settlements deleted", trip.id(), triggerType, deleted);
        return new SpendWindowResult(trip.id(), SpendStatus.OPEN, 0);
    }

    private List<SettlementDraft> toDrafts(List<SettlementTransfer> transfers, String currency) {
        List<SettlementDraft> drafts = new ArrayList<>(transfers.size());
        for (SettlementTransfer transfer : transfers) {
            Money amount = Money.of(transfer.amount(), currency);
            // zero-decimal currencies can round a transfer just above tolerance down to nothing
            if (amount.isZero()) {
                log.debug("Skipping transfer {} -> {} of {} {}: rounds to zero",
                        transfer.from().id(), transfer.to().id(), transfer.amount(), currency);
                continue;
            }
            drafts.add(SettlementDraft.builder()
                    .fromUserId(transfer.from().id())
                    .toUserId(transfer.to().id())
                    .amount(amount.toDecimal())
                    .currency(currency)
                    .notes(transfer.oldestDebtDate() != null
                            ? DEBT_SINCE + transfer.oldestDebtDate().toLocalDate()
                            : null)
                    .build());
        }
        return drafts;
    }

    private void requireOrganizer(UUID tripId, String actingUserId) throws ForbiddenOperationException {
        TripMemberRole role = tripLedgerStore.findMemberRole(tripId, actingUserId).orElse(null);
        if (role == null || !role.isOrganizer()) {
            log.warn("User {} is not an organizer of trip {}; spend status change rejected", actingUserId, tripId);
            throw new ForbiddenOperationException("Only trip organizers can change spend status");
        }
    }
}
