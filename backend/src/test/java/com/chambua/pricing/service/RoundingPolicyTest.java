package com.chambua.pricing.service;

import com.chambua.pricing.config.PricingSettings;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundingPolicyTest {

    private final RoundingPolicy policy = RoundingPolicy.stepped();

    @Test
    void roundsUpToFiftyBelowThreshold() {
        QuotedPrice q = policy.quote(new BigDecimal("130"));
        assertThat(q.price()).isEqualByComparingTo("150");
        assertThat(q.delta()).isEqualByComparingTo("20");
        assertThat(q.delta().scale()).isEqualTo(2);
    }

    @Test
    void exactMultipleIsKept() {
        QuotedPrice q = policy.quote(new BigDecimal("100"));
        assertThat(q.price()).isEqualByComparingTo("100");
        assertThat(q.delta()).isEqualByComparingTo("0");
    }

    @Test
    void thresholdItselfUsesLargeStep() {
        assertThat(policy.quote(new BigDecimal("1000")).price()).isEqualByComparingTo("1000");
        assertThat(policy.quote(new BigDecimal("1000.01")).price()).isEqualByComparingTo("1500");
        assertThat(policy.quote(new BigDecimal("999.99")).price()).isEqualByComparingTo("1000");
    }

    @Test
    void centsAreRoundedUpNotTruncated() {
        QuotedPrice q = policy.quote(new BigDecimal("50.01"));
        assertThat(q.price()).isEqualByComparingTo("100");
        assertThat(q.delta()).isEqualByComparingTo("49.99");
    }

    @Test
    void moreThanTwoDecimalsAreNormalizedHalfUp() {
        QuotedPrice q = policy.quote(new BigDecimal("49.995"));
        // 49.995 -> 50.00 before rounding
        assertThat(q.price()).isEqualByComparingTo("50");
        assertThat(q.delta()).isEqualByComparingTo("0");
    }

    @Test
    void zeroQuotesZero() {
        QuotedPrice q = policy.quote(BigDecimal.ZERO);
        assertThat(q.price()).isEqualByComparingTo("0");
        assertThat(q.delta()).isEqualByComparingTo("0");
    }

    @Test
    void quotedPriceIsAlwaysAStepMultipleAndNeverBelowRaw() {
        for (int cents = 0; cents < 300_000; cents += 737) {
            BigDecimal raw = BigDecimal.valueOf(cents, 2);
            QuotedPrice q = policy.quote(raw);
            BigDecimal step = raw.compareTo(new BigDecimal("1000")) < 0 ? new BigDecimal("50") : new BigDecimal("500");
            assertThat(q.price().remainder(step)).isEqualByComparingTo("0");
            assertThat(q.delta().signum()).isGreaterThanOrEqualTo(0);
            assertThat(q.delta()).isLessThan(step);
            assertThat(q.price().subtract(raw)).isEqualByComparingTo(q.delta());
        }
    }

    @Test
    void quotingTheQuotedPriceIsStable() {
        QuotedPrice once = policy.quote(new BigDecimal("1234.56"));
        QuotedPrice twice = policy.quote(once.price());
        assertThat(twice.price()).isEqualByComparingTo(once.price());
        assertThat(twice.delta()).isEqualByComparingTo("0");
    }

    @Test
    void noneModeQuotesRawPrice() {
        QuotedPrice q = RoundingPolicy.none().quote(new BigDecimal("137.4"));
        assertThat(q.price()).isEqualByComparingTo("137.40");
        assertThat(q.delta()).isEqualByComparingTo("0");
    }

    @Test
    void stepsComeFromSettings() {
        PricingSettings settings = new PricingSettings();
        settings.setSmallStep(new BigDecimal("10"));
        settings.setLargeStep(new BigDecimal("100"));
        settings.setRoundingThreshold(new BigDecimal("500"));
        RoundingPolicy custom = new RoundingPolicy(settings);

        assertThat(custom.quote(new BigDecimal("101")).price()).isEqualByComparingTo("110");
        assertThat(custom.quote(new BigDecimal("501")).price()).isEqualByComparingTo("600");
    }

    @Test
    void rejectsNegativeAndMissingPrices() {
        assertThatThrownBy(() -> policy.quote(new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.quote(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveSteps() {
        assertThatThrownBy(() -> new RoundingPolicy(PricingSettings.RoundingMode.STEPPED, new BigDecimal("1000"), BigDecimal.ZERO, new BigDecimal("500")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quoteBeyondStoredPrecisionIsRejected() {
        assertThatThrownBy(() -> policy.quote(new BigDecimal("1E+20")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds");
        assertThatThrownBy(() -> policy.quote(new BigDecimal("9999999999.99")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Quoted price");
        assertThat(RoundingPolicy.none().quote(new BigDecimal("9999999999.99")).price()).isEqualByComparingTo("9999999999.99");
    }
}
