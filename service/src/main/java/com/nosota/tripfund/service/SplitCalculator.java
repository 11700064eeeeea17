package com.nosota.tripfund.service;

import com.nosota.tripfund.api.model.Money;
import com.nosota.tripfund.api.model.SplitType;
import com.nosota.tripfund.api.request.AssignmentRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Derives share amounts of an expense from its assignments.
 *
 * <ul>
 *   <li>EQUAL - amount divided evenly, split value ignored</li>
 *   <li>SHARE - proportional to the split values (e.g. 2 : 1 : 1)</li>
 *   <li>PERCENTAGE - split value is a percentage of the amount</li>
 *   <li>EXACT - split value is the share itself</li>
 * </ul>
 *
 * <p>Shares are calculated in minor units of the expense currency. Leftover minor units
 * go to the entries with the largest dropped fractions (ties to the earlier entry), so
 * EQUAL, SHARE and 100% PERCENTAGE splits always add up to the amount exactly.
 *
 * <p>Example: 100.00 EUR split EQUAL among 3 → 33.34, 33.33, 33.33.
 */
@Component
public class SplitCalculator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final int WORK_SCALE = 12;

    /**
     * Calculates one share per assignment, in the same order.
     *
     * @param amount      Expense amount in its own currency
     * @param currency    Expense currency
     * @param assignments Requested splits; all entries must use the same split type
     * @return Share amounts scaled to the currency's minor unit
     * @throws IllegalArgumentException if split types are mixed or split values are missing or invalid
     */
    public List<BigDecimal> calculateShares(BigDecimal amount, String currency, List<AssignmentRequest> assignments) {
        if (assignments.isEmpty()) {
            return List.of();
        }

        SplitType splitType = assignments.get(0).splitType();
        for (AssignmentRequest assignment : assignments) {
            if (assignment.splitType() != splitType) {
                throw new IllegalArgumentException(String.format(
                        "All assignments must use the same split type, got %s and %s",
                        splitType, assignment.splitType()));
            }
        }

        long totalMinor = Money.of(amount, currency).minorUnits();
        long[] minorShares = switch (splitType) {
            case EQUAL -> allocate(totalMinor, assignments.stream().map(a -> BigDecimal.ONE).toList());
            case SHARE -> allocate(totalMinor, splitValues(assignments, splitType));
            case PERCENTAGE -> percentages(totalMinor, splitValues(assignments, splitType));
            case EXACT -> splitValues(assignments, splitType).stream()
                    .mapToLong(value -> Money.of(value, currency).minorUnits())
                    .toArray();
        };

        List<BigDecimal> shares = new ArrayList<>(minorShares.length);
        for (long minor : minorShares) {
            shares.add(Money.ofMinor(minor, currency).toDecimal());
        }
        return shares;
    }

    private long[] percentages(long totalMinor, List<BigDecimal> percentages) {
        BigDecimal sum = percentages.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (sum.compareTo(ONE_HUNDRED) == 0) {
            return allocate(totalMinor, percentages);
        }
        // incomplete percentages stay incomplete; finalize reports the gap
        return percentages.stream()
                .mapToLong(p -> BigDecimal.valueOf(totalMinor).multiply(p)
                        .divide(ONE_HUNDRED, 0, RoundingMode.HALF_UP)
                        .longValueExact())
                .toArray();
    }

    /**
     * Largest-remainder apportionment of {@code totalMinor} by weight.
     */
    private long[] allocate(long totalMinor, List<BigDecimal> weights) {
        BigDecimal weightSum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weightSum.signum() <= 0) {
            throw new IllegalArgumentException("Split values must add up to a positive number");
        }

        int n = weights.size();
        long[] result = new long[n];
        BigDecimal[] fractions = new BigDecimal[n];
        long allocated = 0;

        for (int i = 0; i < n; i++) {
            BigDecimal exact = BigDecimal.valueOf(totalMinor)
                    .multiply(weights.get(i))
                    .divide(weightSum, WORK_SCALE, RoundingMode.DOWN);
            BigDecimal floor = exact.setScale(0, RoundingMode.DOWN);
            result[i] = floor.longValueExact();
            fractions[i] = exact.subtract(floor);
            allocated += result[i];
        }

        List<Integer> order = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparing((Integer i) -> fractions[i]).reversed()
                        .thenComparing(i -> i))
                .toList();
        long leftover = totalMinor - allocated;
        for (int k = 0; k < leftover; k++) {
            result[order.get(k % n)]++;
        }
        return result;
    }

    private static List<BigDecimal> splitValues(List<AssignmentRequest> assignments, SplitType splitType) {
        List<BigDecimal> values = new ArrayList<>(assignments.size());
        for (AssignmentRequest assignment : assignments) {
            if (assignment.splitValue() == null) {
                throw new IllegalArgumentException(String.format(
                        "Split value is required for %s split (user %s)", splitType, assignment.userId()));
            }
            if (assignment.splitValue().signum() < 0) {
                throw new IllegalArgumentException("Split value must be non-negative");
            }
            values.add(assignment.splitValue());
        }
        return values;
    }
}
