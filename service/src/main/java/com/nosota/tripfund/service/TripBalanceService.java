package com.nosota.tripfund.service;

import com.nosota.tripfund.api.dto.PersonBalanceDTO;
import com.nosota.tripfund.api.dto.SettlementTransferDTO;
import com.nosota.tripfund.api.model.Money;
import com.nosota.tripfund.api.response.TripBalanceSummaryResponse;
import com.nosota.tripfund.api.response.UserBalanceResponse;
import com.nosota.tripfund.dto.*;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.TripNotFoundException;
import com.nosota.tripfund.repository.TripLedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read-only balance queries for trip members.
 *
 * <p>Balances are computed fresh on every call and never cached. All amounts are
 * rounded to the base currency's minor unit here, after planning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripBalanceService {

    private final TripLedgerStore tripLedgerStore;
    private final BalanceAggregator balanceAggregator;
    private final SettlementPlanner settlementPlanner;

    /**
     * Calculates per-person balances and the suggested transfers for a trip.
     *
     * @param tripId       Trip UUID
     * @param actingUserId Caller, must be a trip member
     * @return Balance summary
     */
    public TripBalanceSummaryResponse calculateTripBalances(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        TripSnapshot trip = requireMemberTrip(tripId, actingUserId);

        List<LedgerExpense> expenses = tripLedgerStore.listExpenses(tripId);
        BalanceSheet sheet = balanceAggregator.aggregate(new TripLedger(tripId, trip.baseCurrency(), expenses));
        List<SettlementTransfer> transfers = settlementPlanner.plan(sheet);

        String currency = trip.baseCurrency();
        List<PersonBalanceDTO> balances = sheet.balances().stream()
                .map(balance -> new PersonBalanceDTO(
                        balance.user().id(),
                        balance.user().name(),
                        balance.user().email(),
                        balance.user().photoUrl(),
                        Money.round(balance.totalPaid(), currency),
                        Money.round(balance.totalOwed(), currency),
                        Money.round(balance.netBalance(), currency)))
                .toList();
        List<SettlementTransferDTO> settlements = transfers.stream()
                .map(transfer -> new SettlementTransferDTO(
                        transfer.from().id(),
                        transfer.from().name(),
                        transfer.to().id(),
                        transfer.to().name(),
                        Money.round(transfer.amount(), currency),
                        transfer.oldestDebtDate()))
                .toList();

        log.debug("Calculated balances for trip {}: {} participants, {} transfers",
                tripId, balances.size(), settlements.size());

        return new TripBalanceSummaryResponse(
                tripId,
                currency,
                Money.round(sheet.totalSpent(), currency),
                balances,
                settlements,
                sheet.calculatedAt());
    }

    /**
     * Calculates how much a single user owes and is owed across the trip.
     *
     * <p>For expenses the user paid, {@code userIsOwed} grows by the part of the expense
     * assigned to others; for every other expense {@code userOwes} grows by the user's share.
     *
     * @param tripId       Trip UUID
     * @param actingUserId Caller, must be a trip member
     * @param userId       User to calculate for
     * @return Owes / is-owed pair in base currency
     */
    public UserBalanceResponse calculateUserBalance(UUID tripId, String actingUserId, String userId)
            throws TripNotFoundException, ForbiddenOperationException {
        TripSnapshot trip = requireMemberTrip(tripId, actingUserId);

        BigDecimal userOwes = BigDecimal.ZERO;
        BigDecimal userIsOwed = BigDecimal.ZERO;

        for (LedgerExpense expense : tripLedgerStore.listExpenses(tripId)) {
            BigDecimal ownShare = expense.assignments().stream()
                    .filter(a -> a.user().id().equals(userId))
                    .map(LedgerAssignment::normalizedShareAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            if (expense.paidBy().id().equals(userId)) {
                userIsOwed = userIsOwed.add(expense.normalizedAmount().subtract(ownShare));
            } else {
                userOwes = userOwes.add(ownShare);
            }
        }

        return new UserBalanceResponse(
                tripId,
                userId,
                Money.round(userOwes, trip.baseCurrency()),
                Money.round(userIsOwed, trip.baseCurrency()));
    }

    private TripSnapshot requireMemberTrip(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        TripSnapshot trip = tripLedgerStore.findActiveTrip(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
        if (tripLedgerStore.findMemberRole(tripId, actingUserId).isEmpty()) {
            throw new ForbiddenOperationException("You are not a member of this trip");
        }
        return trip;
    }
}
