package com.nosota.tripfund.service;

import com.nosota.tripfund.dto.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Computes per-person balances of a trip from its expenses and cost assignments.
 *
 * <p>For every expense:
 * <ul>
 *   <li>the payer's totalPaid grows by the normalized amount</li>
 *   <li>each assignee's totalOwed grows by the normalized share</li>
 * </ul>
 * and netBalance = totalPaid - totalOwed.
 *
 * <p>The aggregator is pure: it performs no validation and never rounds. Expenses of any
 * status are included, and under-assigned expenses are reflected as is, so balances only
 * sum to zero when every expense is fully assigned.
 *
 * <p>Example:
 * <pre>
 * Expense 100.00 paid by U1, assigned U1=50.00, U2=50.00
 *   U1: paid=100.00, owed=50.00, net=+50.00
 *   U2: paid=0,      owed=50.00, net=-50.00
 * </pre>
 *
 * <p>It also records the debt age: for each assignment to someone other than the payer,
 * the oldest expense date per (assignee → payer) pair.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceAggregator {

    private final Clock clock;

    /**
     * Aggregates the ledger into a balance sheet.
     *
     * @param ledger Trip expenses, oldest first
     * @return Balances in first-appearance order, total spent and debt ages
     */
    public BalanceSheet aggregate(TripLedger ledger) {
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        Map<DebtPair, LocalDateTime> debtAges = new HashMap<>();
        BigDecimal totalSpent = BigDecimal.ZERO;

        for (LedgerExpense expense : ledger.expenses()) {
            BigDecimal normalizedAmount = orZero(expense.normalizedAmount());
            ParticipantRef payer = expense.paidBy();

            totalSpent = totalSpent.add(normalizedAmount);
            Accumulator paidBy = accumulatorFor(accumulators, payer);
            paidBy.paid = paidBy.paid.add(normalizedAmount);

            if (expense.assignments() == null) {
                continue;
            }
            for (LedgerAssignment assignment : expense.assignments()) {
                BigDecimal share = orZero(assignment.normalizedShareAmount());
                Accumulator assignee = accumulatorFor(accumulators, assignment.user());
                assignee.owed = assignee.owed.add(share);

                if (!assignment.user().id().equals(payer.id()) && share.signum() > 0 && expense.date() != null) {
                    debtAges.merge(new DebtPair(assignment.user().id(), payer.id()), expense.date(),
                            (existing, candidate) -> candidate.isBefore(existing) ? candidate : existing);
                }
            }
        }

        List<PersonBalance> balances = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators.values()) {
            balances.add(new PersonBalance(
                    accumulator.user,
                    accumulator.paid,
                    accumulator.owed,
                    accumulator.paid.subtract(accumulator.owed)));
        }

        log.debug("Aggregated trip {}: {} expenses, {} participants, totalSpent={}",
                ledger.tripId(), ledger.expenses().size(), balances.size(), totalSpent);

        return BalanceSheet.builder()
                .tripId(ledger.tripId())
                .baseCurrency(ledger.baseCurrency())
                .totalSpent(totalSpent)
                .balances(balances)
                .debtAges(debtAges)
                .calculatedAt(LocalDateTime.now(clock))
                .build();
    }

    private static Accumulator accumulatorFor(Map<String, Accumulator> accumulators, ParticipantRef user) {
        return accumulators.computeIfAbsent(user.id(), id -> new Accumulator(user));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static final class Accumulator {
        private final ParticipantRef user;
        private BigDecimal paid = BigDecimal.ZERO;
        private BigDecimal owed = BigDecimal.ZERO;

        private Accumulator(ParticipantRef user) {
            this.user = user;
        }
    }
}
