package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.SplitType;
import com.nosota.tripfund.api.request.AssignmentRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SplitCalculatorTest {

    private final SplitCalculator calculator = new SplitCalculator();

    @Test
    public void equalSplitGivesLeftoverCentToFirstEntry() {
        List<BigDecimal> shares = calculator.calculateShares(new BigDecimal("100.00"), "EUR", List.of(
                assignment("u1", SplitType.EQUAL, null),
                assignment("u2", SplitType.EQUAL, null),
                assignment("u3", SplitType.EQUAL, null)));

        assertThat(shares).containsExactly(
                new BigDecimal("33.34"), new BigDecimal("33.33"), new BigDecimal("33.33"));
    }

    @Test
    public void shareSplitIsProportionalToWeights() {
        List<BigDecimal> shares = calculator.calculateShares(new BigDecimal("120"), "USD", List.of(
                assignment("u1", SplitType.SHARE, "2"),
                assignment("u2", SplitType.SHARE, "1"),
                assignment("u3", SplitType.SHARE, "1")));

        assertThat(shares).containsExactly(
                new BigDecimal("60.00"), new BigDecimal("30.00"), new BigDecimal("30.00"));
    }

    @Test
    public void fullPercentageSplitAddsUpExactly() {
        List<BigDecimal> shares = calculator.calculateShares(new BigDecimal("10.00"), "USD", List.of(
                assignment("u1", SplitType.PERCENTAGE, "33.333"),
                assignment("u2", SplitType.PERCENTAGE, "33.333"),
                assignment("u3", SplitType.PERCENTAGE, "33.334")));

        BigDecimal total = shares.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("10.00");
    }

    @Test
    public void partialPercentageSplitStaysPartial() {
        List<BigDecimal> shares = calculator.calculateShares(new BigDecimal("200"), "USD", List.of(
                assignment("u1", SplitType.PERCENTAGE, "25"),
                assignment("u2", SplitType.PERCENTAGE, "25")));

        assertThat(shares).containsExactly(new BigDecimal("50.00"), new BigDecimal("50.00"));
    }

    @Test
    public void exactSplitRoundsToCurrencyPrecision() {
        List<BigDecimal> shares = calculator.calculateShares(new BigDecimal("1000"), "JPY", List.of(
                assignment("u1", SplitType.EXACT, "333.5"),
                assignment("u2", SplitType.EXACT, "666.4")));

        assertThat(shares).containsExactly(new BigDecimal("334"), new BigDecimal("666"));
    }

    @Test
    public void mixedSplitTypesAreRejected() {
        assertThatThrownBy(() -> calculator.calculateShares(new BigDecimal("10"), "USD", List.of(
                assignment("u1", SplitType.EQUAL, null),
                assignment("u2", SplitType.EXACT, "5"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same split type");
    }

    @Test
    public void missingSplitValueIsRejected() {
        assertThatThrownBy(() -> calculator.calculateShares(new BigDecimal("10"), "USD", List.of(
                assignment("u1", SplitType.SHARE, null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("u1");
    }

    @Test
    public void zeroWeightsAreRejected() {
        assertThatThrownBy(() -> calculator.calculateShares(new BigDecimal("10"), "USD", List.of(
                assignment("u1", SplitType.SHARE, "0"),
                assignment("u2", SplitType.SHARE, "0"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void noAssignmentsNoShares() {
        assertThat(calculator.calculateShares(new BigDecimal("10"), "USD", List.of())).isEmpty();
    }

    private static AssignmentRequest assignment(String userId, SplitType splitType, String value) {
        return new AssignmentRequest(userId, splitType, value != null ? new BigDecimal(value) : null);
    }
}
