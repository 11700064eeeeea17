package com.nosota.tripfund.api.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;

/**
 * Monetary amount expressed in minor units of an ISO 4217 currency.
 *
 * <p>All decimal amounts crossing the API boundary are converted through this type,
 * so rounding to the currency's precision happens in exactly one place:
 * <ul>
 *   <li>{@link #of(BigDecimal, String)} - decimal to minor units (HALF_UP)</li>
 *   <li>{@link #toDecimal()} - minor units back to a decimal with the currency scale</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   Money.of(new BigDecimal("10.005"), "EUR")  → minorUnits=1001, toDecimal()=10.01
 *   Money.of(new BigDecimal("1500.4"), "JPY")  → minorUnits=1500, toDecimal()=1500
 * </pre>
 *
 * @param minorUnits   amount in the currency's smallest unit (cents for USD)
 * @param currencyCode ISO 4217 currency code
 */
public record Money(long minorUnits, String currencyCode) {

    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public Money {
        currencyCode = normalizeCurrency(currencyCode);
    }

    /**
     * Converts a decimal amount to minor units, rounding half up.
     *
     * @param amount       decimal amount (any scale)
     * @param currencyCode ISO 4217 code
     * @return money value
     * @throws IllegalArgumentException if the amount is null or the currency is unknown
     */
    public static Money of(BigDecimal amount, String currencyCode) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        int digits = fractionDigits(currencyCode);
        BigDecimal minor = amount.setScale(digits, ROUNDING).movePointRight(digits);
        return new Money(minor.longValueExact(), currencyCode);
    }

    public static Money ofMinor(long minorUnits, String currencyCode) {
        return new Money(minorUnits, currencyCode);
    }

    public static Money zero(String currencyCode) {
        return new Money(0L, currencyCode);
    }

    /**
     * Rounds a decimal amount to the precision of the given currency.
     */
    public static BigDecimal round(BigDecimal amount, String currencyCode) {
        return of(amount, currencyCode).toDecimal();
    }

    /**
     * Number of decimal places used by the currency (2 for USD, 0 for JPY, 3 for BHD).
     * Pseudo-currencies without a defined precision are treated as 2.
     */
    public static int fractionDigits(String currencyCode) {
        int digits = Currency.getInstance(normalizeCurrency(currencyCode)).getDefaultFractionDigits();
        return digits < 0 ? 2 : digits;
    }

    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(minorUnits, fractionDigits(currencyCode));
    }

    public boolean isZero() {
        return minorUnits == 0L;
    }

    @Override
    public String toString() {
        return toDecimal().toPlainString() + " " + currencyCode;
    }

    private static String normalizeCurrency(String currencyCode) {
        if (currencyCode == null || currencyCode.length() != 3) {
            throw new IllegalArgumentException("Currency must be a 3-letter ISO 4217 code: " + currencyCode);
        }
        String code = currencyCode.toUpperCase(Locale.ROOT);
        // Currency.getInstance rejects codes it does not know
        Currency.getInstance(code);
        return code;
    }
}
