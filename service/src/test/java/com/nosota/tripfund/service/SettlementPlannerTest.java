package com.nosota.tripfund.service;

import com.nosota.tripfund.dto.BalanceSheet;
import com.nosota.tripfund.dto.DebtPair;
import com.nosota.tripfund.dto.PersonBalance;
import com.nosota.tripfund.dto.SettlementTransfer;
import com.nosota.tripfund.dto.TripLedger;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static com.nosota.tripfund.service.LedgerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

public class SettlementPlannerTest {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 5, 1, 12, 0);

    private final SettlementPlanner planner = new SettlementPlanner(TOLERANCE);
    private final BalanceAggregator aggregator = new BalanceAggregator(Clock.systemUTC());

    @Test
    public void twoPeopleOneTransfer() {
        BalanceSheet sheet = aggregator.aggregate(new TripLedger(UUID.randomUUID(), "USD", List.of(
                expense("u1", "100", DAY_1, share("u1", "50"), share("u2", "50")))));

        List<SettlementTransfer> transfers = planner.plan(sheet);

        assertThat(transfers).hasSize(1);
        SettlementTransfer transfer = transfers.get(0);
        assertThat(transfer.from().id()).isEqualTo("u2");
        assertThat(transfer.to().id()).isEqualTo("u1");
        assertThat(transfer.amount()).isEqualByComparingTo("50");
        assertThat(transfer.oldestDebtDate()).isEqualTo(DAY_1);
    }

    @Test
    public void threePeopleTwoTransfers() {
        BalanceSheet sheet = aggregator.aggregate(new TripLedger(UUID.randomUUID(), "USD", List.of(
                expense("u1", "90", DAY_1, share("u1", "30"), share("u2", "30"), share("u3", "30")),
                expense("u2", "30", DAY_1, share("u1", "10"), share("u2", "10"), share("u3", "10")))));

        List<SettlementTransfer> transfers = planner.plan(sheet);

        assertThat(transfers).hasSize(2);
        assertThat(transfers.get(0).from().id()).isEqualTo("u3");
        assertThat(transfers.get(0).to().id()).isEqualTo("u1");
        assertThat(transfers.get(0).amount()).isEqualByComparingTo("40");
        assertThat(transfers.get(1).from().id()).isEqualTo("u2");
        assertThat(transfers.get(1).to().id()).isEqualTo("u1");
        assertThat(transfers.get(1).amount()).isEqualByComparingTo("10");
        assertSettles(sheet.balances(), transfers);
    }

    @Test
    public void everyoneCoveredOwnShareNeedsNoTransfers() {
        BalanceSheet sheet = aggregator.aggregate(new TripLedger(UUID.randomUUID(), "USD", List.of(
                expense("u1", "40", DAY_1, share("u1", "40")),
                expense("u2", "25", DAY_1, share("u2", "25")))));

        assertThat(planner.plan(sheet)).isEmpty();
    }

    @Test
    public void underAssignedLedgerStillPlansFromActualBalances() {
        BalanceSheet sheet = aggregator.aggregate(new TripLedger(UUID.randomUUID(), "USD", List.of(
                expense("u1", "100", DAY_1, share("u2", "30"), share("u3", "30")))));

        List<SettlementTransfer> transfers = planner.plan(sheet);

        // creditor is left with the unassigned 40
        assertThat(transfers).hasSize(2);
        assertThat(transfers).allMatch(transfer -> transfer.to().id().equals("u1"));
        BigDecimal total = transfers.stream().map(SettlementTransfer::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("60");
    }

    @Test
    public void balancesWithinToleranceAreSettled() {
        List<SettlementTransfer> transfers = planner.plan(List.of(
                net("u1", "0.01"),
                net("u2", "-0.01"),
                net("u3", "0.005")), Map.of());

        assertThat(transfers).isEmpty();
    }

    @Test
    public void equalBalancesAreOrderedByUserId() {
        List<PersonBalance> balances = List.of(
                net("c", "10"), net("a", "10"),
                net("y", "-10"), net("x", "-10"));

        List<SettlementTransfer> first = planner.plan(balances, Map.of());
        List<PersonBalance> reversed = new ArrayList<>(balances);
        Collections.reverse(reversed);
        List<SettlementTransfer> second = planner.plan(reversed, Map.of());

        assertThat(first).extracting(transfer -> transfer.from().id() + ">" + transfer.to().id())
                .containsExactly("x>a", "y>c");
        assertThat(second).isEqualTo(first);
    }

    @Test
    public void missingDebtAgeLeavesDateEmpty() {
        Map<DebtPair, LocalDateTime> debtAges = new HashMap<>();
        debtAges.put(new DebtPair("u9", "u1"), DAY_1);

        List<SettlementTransfer> transfers = planner.plan(List.of(net("u1", "5"), net("u2", "-5")), debtAges);

        assertThat(transfers).singleElement().satisfies(transfer -> assertThat(transfer.oldestDebtDate()).isNull());
    }

    @Test
    public void randomBalancesAreSettledWithAtMostNMinusOneTransfers() {
        Random random = new Random(20240501L);

        for (int round = 0; round < 200; round++) {
            int people = 2 + random.nextInt(9);
            List<PersonBalance> balances = new ArrayList<>();
            long sum = 0;
            for (int i = 0; i < people - 1; i++) {
                long cents;
                do {
                    cents = random.nextInt(200_001) - 100_000;
                } while (Math.abs(cents) <= 1);
                sum += cents;
                balances.add(net("user-" + i, BigDecimal.valueOf(cents, 2).toPlainString()));
            }
            balances.add(net("user-" + (people - 1), BigDecimal.valueOf(-sum, 2).toPlainString()));

            List<SettlementTransfer> transfers = planner.plan(balances, Map.of());

            long unsettled = balances.stream()
                    .filter(balance -> balance.netBalance().abs().compareTo(TOLERANCE) > 0)
                    .count();
            assertThat(transfers.size()).isLessThanOrEqualTo((int) Math.max(0, unsettled - 1));
            assertThat(transfers).allMatch(transfer -> transfer.amount().compareTo(TOLERANCE) > 0);
            assertSettles(balances, transfers);
        }
    }

    private static void assertSettles(List<PersonBalance> balances, List<SettlementTransfer> transfers) {
        Map<String, BigDecimal> remaining = new HashMap<>();
        for (PersonBalance balance : balances) {
            remaining.put(balance.user().id(), balance.netBalance());
        }
        for (SettlementTransfer transfer : transfers) {
            remaining.merge(transfer.from().id(), transfer.amount(), BigDecimal::add);
            remaining.merge(transfer.to().id(), transfer.amount().negate(), BigDecimal::add);
        }
        assertThat(remaining.values()).allMatch(value -> value.abs().compareTo(TOLERANCE) <= 0);
    }
}
