package com.nosota.tripfund.service;

import com.nosota.tripfund.dto.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Turns net balances into a short list of debtor → creditor transfers.
 *
 * <p>Greedy largest-creditor / largest-debtor matching:
 * <ol>
 *   <li>Creditors are users with net &gt; tolerance, debtors those with net &lt; -tolerance;
 *       everyone else is settled.</li>
 *   <li>Take the largest remaining creditor and the largest remaining debtor and transfer
 *       min(creditor, debtor) from the debtor to the creditor.</li>
 *   <li>Whoever still has more than the tolerance left goes back into the pool.</li>
 *   <li>Stop when either side is empty.</li>
 * </ol>
 *
 * <p>Each round settles at least one party, so N unsettled parties with balances summing
 * to zero need at most N-1 transfers. Equal remainders are ordered by user ID, which makes
 * the plan deterministic for a given set of balances.
 *
 * <p>Amounts are not rounded here; rounding to the currency's minor unit happens when a
 * transfer is presented or persisted.
 */
@Component
@Slf4j
public class SettlementPlanner {

    private static final Comparator<Party> LARGEST_FIRST = Comparator
            .comparing((Party party) -> party.remaining).reversed()
            .thenComparing(party -> party.user.id());

    private final BigDecimal tolerance;

    public SettlementPlanner(@Value("${settlement.tolerance:0.01}") BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * Plans transfers for an aggregated trip, annotated with debt ages.
     */
    public List<SettlementTransfer> plan(BalanceSheet sheet) {
        return plan(sheet.balances(), sheet.debtAges());
    }

    /**
     * Plans transfers that bring every balance within tolerance of zero.
     *
     * @param balances Net balances
     * @param debtAges Oldest expense date per debtor → creditor pair; may be empty
     * @return Transfers in the order they were matched; empty when everyone is settled
     */
    public List<SettlementTransfer> plan(List<PersonBalance> balances, Map<DebtPair, LocalDateTime> debtAges) {
        PriorityQueue<Party> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Party> debtors = new PriorityQueue<>(LARGEST_FIRST);

        for (PersonBalance balance : balances) {
            BigDecimal net = balance.netBalance();
            if (net.compareTo(tolerance) > 0) {
                creditors.add(new Party(balance.user(), net));
            } else if (net.compareTo(tolerance.negate()) < 0) {
                debtors.add(new Party(balance.user(), net.negate()));
            }
        }

        int parties = creditors.size() + debtors.size();
        List<SettlementTransfer> transfers = new ArrayList<>();

        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Party creditor = creditors.poll();
            Party debtor = debtors.poll();

            BigDecimal amount = creditor.remaining.min(debtor.remaining);
            LocalDateTime oldestDebtDate = debtAges != null
                    ? debtAges.get(new DebtPair(debtor.user.id(), creditor.user.id()))
                    : null;
            transfers.add(new SettlementTransfer(debtor.user, creditor.user, amount, oldestDebtDate));

            creditor.remaining = creditor.remaining.subtract(amount);
            debtor.remaining = debtor.remaining.subtract(amount);

            if (creditor.remaining.compareTo(tolerance) > 0) {
                creditors.add(creditor);
            }
            if (debtor.remaining.compareTo(tolerance) > 0) {
                debtors.add(debtor);
            }
        }

        log.debug("Planned {} transfers for {} unsettled parties (tolerance={})",
                transfers.size(), parties, tolerance);
        return transfers;
    }

    private static final class Party {
        private final ParticipantRef user;
        private BigDecimal remaining;

        private Party(ParticipantRef user, BigDecimal remaining) {
            this.user = user;
            this.remaining = remaining;
        }
    }
}
