package com.fintech.paymentengine.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should normalise the amount to the currency's minor units")
        void shouldNormaliseScale() {
            Money money = Money.of("30.1", "MXN");

            assertThat(money.getAmount()).isEqualTo(new BigDecimal("30.10"));
            assertThat(money).isEqualTo(Money.of(new BigDecimal("30.1000"), "MXN"));
        }

        @Test
        @DisplayName("Should reject more precision than the currency allows")
        void shouldRejectExcessPrecision() {
            assertThatThrownBy(() -> Money.of("10.005", "USD"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("USD");
        }

        @Test
        @DisplayName("Should use zero decimals for currencies without minor units")
        void shouldHandleZeroDecimalCurrencies() {
            assertThat(Money.of("1500", "JPY").getAmount()).isEqualTo(new BigDecimal("1500"));
            assertThatThrownBy(() -> Money.of("1500.5", "JPY")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should accept lower-case currency codes regardless of the default locale")
        void shouldNormaliseCurrencyCode() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                assertThat(Money.of("1000", " idr").getCurrency()).isEqualTo("IDR");
            } finally {
                Locale.setDefault(previous);
            }
        }

        @Test
        @DisplayName("Should reject unknown currency codes")
        void shouldRejectUnknownCurrency() {
            assertThatThrownBy(() -> Money.of("1.00", "XYZW")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Money.of("1.00", " ")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Should add and subtract exactly")
        void shouldAddAndSubtract() {
            Money a = Money.of("0.10", "USD");
            Money b = Money.of("0.20", "USD");

            assertThat(a.add(b)).isEqualTo(Money.of("0.30", "USD"));
            assertThat(a.subtract(b)).isEqualTo(Money.of("-0.10", "USD"));
            assertThat(a.subtract(b).isNegative()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to mix currencies")
        void shouldRefuseCurrencyMix() {
            assertThatThrownBy(() -> Money.of("1.00", "USD").add(Money.of("1.00", "EUR")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Currency mismatch");
        }

        @Test
        @DisplayName("Should round percentages half down")
        void shouldRoundPercentageHalfDown() {
            // 10% of 0.25 is 0.025
            assertThat(Money.of("0.25", "USD").percentage(new BigDecimal("10"))).isEqualTo(Money.of("0.02", "USD"));
            // 10% of 0.35 is 0.035
            assertThat(Money.of("0.35", "USD").percentage(new BigDecimal("10"))).isEqualTo(Money.of("0.03", "USD"));
            assertThat(Money.of("100.00", "USD").percentage(new BigDecimal("7.5"))).isEqualTo(Money.of("7.50", "USD"));
        }

        @Test
        @DisplayName("Should compare amounts in the same currency")
        void shouldCompare() {
            assertThat(Money.of("5.00", "EUR")).isLessThan(Money.of("5.01", "EUR"));
            assertThat(Money.of("5.00", "EUR").toString()).isEqualTo("5.00 EUR");
        }
    }
}
