package com.chambua.pricing.service;

import com.chambua.pricing.config.PricingSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Maps a raw supplier price to the quoted price.
 *
 * In {@link PricingSettings.RoundingMode#STEPPED} mode prices below the threshold are rounded up to a
 * multiple of the small step and prices at or above it to a multiple of the large step. Rounding is
 * always upwards so the quoted price never undercuts the raw price. All arithmetic is done on whole
 * cents. {@link PricingSettings.RoundingMode#NONE} quotes the raw price unchanged.
 */
@Component
public class RoundingPolicy {

    /** Largest price the DECIMAL(12,2) price columns hold. */
    public static final BigDecimal MAX_PRICE = new BigDecimal("9999999999.99");

    private final PricingSettings.RoundingMode mode;
    private final BigDecimal threshold;
    private final long smallStepCents;
    private final long largeStepCents;

    @Autowired
    public RoundingPolicy(PricingSettings settings) {
        this(settings.getRoundingMode(), settings.getRoundingThreshold(), settings.getSmallStep(), settings.getLargeStep());
    }

    public RoundingPolicy(PricingSettings.RoundingMode mode, BigDecimal threshold, BigDecimal smallStep, BigDecimal largeStep) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.threshold = normalize(Objects.requireNonNull(threshold, "threshold"));
        this.smallStepCents = toCents(smallStep);
        this.largeStepCents = toCents(largeStep);
        if (smallStepCents <= 0 || largeStepCents <= 0) {
            throw new IllegalArgumentException("Rounding steps must be positive: " + smallStep + ", " + largeStep);
        }
    }

    public static RoundingPolicy stepped() {
        return new RoundingPolicy(PricingSettings.RoundingMode.STEPPED, new BigDecimal("1000"), new BigDecimal("50"), new BigDecimal("500"));
    }

    public static RoundingPolicy none() {
        return new RoundingPolicy(PricingSettings.RoundingMode.NONE, new BigDecimal("1000"), new BigDecimal("50"), new BigDecimal("500"));
    }

    /**
     * @param rawPrice non-negative raw price; values with more than two decimals are rounded half-up to cents first
     * @throws IllegalArgumentException for a null or negative price, or when the raw or quoted price
     *                                  exceeds {@link #MAX_PRICE}
     */
    public QuotedPrice quote(BigDecimal rawPrice) {
        if (rawPrice == null) throw new IllegalArgumentException("Raw price is required");
        BigDecimal raw = normalize(rawPrice);
        if (raw.signum() < 0) throw new IllegalArgumentException("Raw price must not be negative: " + raw);
        if (raw.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("Raw price " + raw.toPlainString() + " exceeds " + MAX_PRICE.toPlainString());
        }

        if (mode == PricingSettings.RoundingMode.NONE) {
            return new QuotedPrice(raw, BigDecimal.ZERO.setScale(2));
        }

        long rawCents = raw.unscaledValue().longValueExact();
        long step = raw.compareTo(threshold) < 0 ? smallStepCents : largeStepCents;
        long quotedCents = ceilToStep(rawCents, step);
        BigDecimal quoted = BigDecimal.valueOf(quotedCents, 2);
        if (quoted.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("Quoted price " + quoted.toPlainString() + " for raw " + raw.toPlainString()
                    + " exceeds " + MAX_PRICE.toPlainString());
        }
        return new QuotedPrice(quoted, BigDecimal.valueOf(quotedCents - rawCents, 2));
    }

    static long ceilToStep(long cents, long step) {
        return Math.floorDiv(cents + step - 1, step) * step;
    }

    static BigDecimal normalize(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static long toCents(BigDecimal value) {
        Objects.requireNonNull(value, "step");
        return normalize(value).unscaledValue().longValueExact();
    }
}
