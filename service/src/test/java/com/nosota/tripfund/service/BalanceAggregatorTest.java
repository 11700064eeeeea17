package com.nosota.tripfund.service;

import com.nosota.tripfund.dto.BalanceSheet;
import com.nosota.tripfund.dto.DebtPair;
import com.nosota.tripfund.dto.LedgerExpense;
import com.nosota.tripfund.dto.PersonBalance;
import com.nosota.tripfund.dto.TripLedger;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.nosota.tripfund.service.LedgerFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

public class BalanceAggregatorTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 5, 1, 12, 0);
    private static final LocalDateTime DAY_2 = LocalDateTime.of(2024, 5, 2, 12, 0);
    private static final LocalDateTime DAY_3 = LocalDateTime.of(2024, 5, 3, 12, 0);

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
    private final BalanceAggregator aggregator = new BalanceAggregator(clock);

    @Test
    public void singleExpenseSplitInHalf() {
        BalanceSheet sheet = aggregate(expense("u1", "100.00", DAY_1, share("u1", "50.00"), share("u2", "50.00")));

        Map<String, PersonBalance> balances = byUser(sheet);
        assertThat(balances.get("u1").totalPaid()).isEqualByComparingTo("100.00");
        assertThat(balances.get("u1").totalOwed()).isEqualByComparingTo("50.00");
        assertThat(balances.get("u1").netBalance()).isEqualByComparingTo("50.00");
        assertThat(balances.get("u2").totalPaid()).isEqualByComparingTo("0");
        assertThat(balances.get("u2").netBalance()).isEqualByComparingTo("-50.00");
        assertThat(sheet.totalSpent()).isEqualByComparingTo("100.00");
        assertThat(sheet.calculatedAt()).isEqualTo(LocalDateTime.of(2024, 6, 1, 10, 0));
    }

    @Test
    public void fullyAssignedExpensesSumToZero() {
        BalanceSheet sheet = aggregate(
                expense("u1", "90", DAY_1, share("u1", "30"), share("u2", "30"), share("u3", "30")),
                expense("u2", "30", DAY_2, share("u1", "10"), share("u2", "10"), share("u3", "10")),
                expense("u3", "17.35", DAY_3, share("u1", "5.78"), share("u2", "5.78"), share("u3", "5.79")));

        BigDecimal sum = sheet.balances().stream()
                .map(PersonBalance::netBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo("0");
        assertThat(sheet.totalSpent()).isEqualByComparingTo("137.35");
    }

    @Test
    public void underAssignedExpenseIsNotCorrected() {
        BalanceSheet sheet = aggregate(expense("u1", "100", DAY_1, share("u2", "30"), share("u3", "30")));

        Map<String, PersonBalance> balances = byUser(sheet);
        assertThat(balances.get("u1").netBalance()).isEqualByComparingTo("100");
        assertThat(balances.get("u2").netBalance()).isEqualByComparingTo("-30");
        assertThat(balances.get("u3").netBalance()).isEqualByComparingTo("-30");

        BigDecimal sum = sheet.balances().stream()
                .map(PersonBalance::netBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo("40");
    }

    @Test
    public void participantsKeepFirstAppearanceOrder() {
        BalanceSheet sheet = aggregate(
                expense("u3", "10", DAY_1, share("u1", "10")),
                expense("u2", "10", DAY_2, share("u3", "10")));

        assertThat(sheet.balances()).extracting(balance -> balance.user().id())
                .containsExactly("u3", "u1", "u2");
    }

    @Test
    public void expenseWithoutAssignmentsCreditsPayerOnly() {
        LedgerExpense unassigned = LedgerExpense.builder()
                .id(UUID.randomUUID())
                .amount(amount("25"))
                .normalizedAmount(amount("25"))
                .date(DAY_1)
                .paidBy(com.nosota.tripfund.dto.ParticipantRef.of("u1"))
                .build();

        BalanceSheet sheet = aggregate(unassigned);

        assertThat(sheet.balances()).hasSize(1);
        assertThat(sheet.balances().get(0).netBalance()).isEqualByComparingTo("25");
        assertThat(sheet.debtAges()).isEmpty();
    }

    @Test
    public void debtAgeKeepsOldestExpenseDatePerPair() {
        BalanceSheet sheet = aggregate(
                expense("u1", "20", DAY_2, share("u1", "10"), share("u2", "10")),
                expense("u1", "20", DAY_1, share("u1", "10"), share("u2", "10")),
                expense("u1", "20", DAY_3, share("u2", "20")),
                expense("u2", "10", DAY_3, share("u1", "10")));

        assertThat(sheet.debtAges())
                .containsEntry(new DebtPair("u2", "u1"), DAY_1)
                .containsEntry(new DebtPair("u1", "u2"), DAY_3)
                .doesNotContainKey(new DebtPair("u1", "u1"));
    }

    @Test
    public void emptyLedgerProducesEmptySheet() {
        BalanceSheet sheet = aggregate();

        assertThat(sheet.balances()).isEmpty();
        assertThat(sheet.totalSpent()).isEqualByComparingTo("0");
    }

    private BalanceSheet aggregate(LedgerExpense... expenses) {
        return aggregator.aggregate(new TripLedger(UUID.randomUUID(), "USD", List.of(expenses)));
    }

    private static Map<String, PersonBalance> byUser(BalanceSheet sheet) {
        return sheet.balances().stream()
                .collect(Collectors.toMap(balance -> balance.user().id(), Function.identity()));
    }
}
