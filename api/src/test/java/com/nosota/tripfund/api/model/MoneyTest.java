package com.nosota.tripfund.api.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MoneyTest {

    @Test
    public void roundsHalfUpToMinorUnits() {
        assertThat(Money.of(new BigDecimal("10.005"), "EUR").minorUnits()).isEqualTo(1001L);
        assertThat(Money.of(new BigDecimal("10.004"), "EUR").minorUnits()).isEqualTo(1000L);
        assertThat(Money.of(new BigDecimal("-10.005"), "EUR").minorUnits()).isEqualTo(-1001L);
    }

    @Test
    public void usesCurrencyPrecision() {
        assertThat(Money.round(new BigDecimal("1500.5"), "JPY")).isEqualTo(new BigDecimal("1501"));
        assertThat(Money.round(new BigDecimal("1.2345"), "BHD")).isEqualTo(new BigDecimal("1.235"));
        assertThat(Money.round(new BigDecimal("7"), "usd")).isEqualTo(new BigDecimal("7.00"));
        assertThat(Money.fractionDigits("USD")).isEqualTo(2);
    }

    @Test
    public void minorUnitsRoundTrip() {
        Money money = Money.ofMinor(110, "usd");

        assertThat(money.currencyCode()).isEqualTo("USD");
        assertThat(money.toDecimal()).isEqualTo(new BigDecimal("1.10"));
        assertThat(money.toString()).isEqualTo("1.10 USD");
        assertThat(money.isZero()).isFalse();
        assertThat(Money.of(new BigDecimal("0.4"), "JPY").isZero()).isTrue();
        assertThat(Money.zero("EUR").isZero()).isTrue();
    }

    @Test
    public void currencyCodeIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // the Turkish locale upper-cases 'i' to a dotted capital
            assertThat(Money.zero("inr").currencyCode()).isEqualTo("INR");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void rejectsUnknownCurrencyAndMissingAmount() {
        assertThatThrownBy(() -> Money.of(BigDecimal.ONE, "XX"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(BigDecimal.ONE, "ZZZ"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(null, "USD"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Amount is required");
    }
}
