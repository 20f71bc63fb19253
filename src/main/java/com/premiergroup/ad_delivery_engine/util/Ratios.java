package com.premiergroup.ad_delivery_engine.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived performance ratios. Every ratio is zero when its denominator is zero.
 */
public final class Ratios {

    public static final int SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Ratios() {
    }

    /** {@code part / whole * 100}. */
    public static BigDecimal percent(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(whole), SCALE, RoundingMode.HALF_UP);
    }

    /** Spend in currency units per unit of {@code count}. */
    public static BigDecimal costPer(long spentMicros, long count) {
        if (count == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return Micros.toUnits(spentMicros).divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentChange(BigDecimal curr, BigDecimal prev) {
        if (prev.compareTo(BigDecimal.ZERO) == 0) {
            return curr.compareTo(BigDecimal.ZERO) == 0
                    ? BigDecimal.ZERO
                    : HUNDRED;
        }
        return curr
                .subtract(prev)
                .divide(prev, SCALE, RoundingMode.HALF_UP)
                .multiply(HUNDRED);
    }

    /**
     * Return on investment in percent for a given value attributed to each conversion.
     */
    public static BigDecimal roi(long conversions, long spentMicros, BigDecimal valuePerConversion) {
        if (spentMicros == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal spent = Micros.toUnits(spentMicros);
        BigDecimal value = valuePerConversion.multiply(BigDecimal.valueOf(conversions));
        return value.subtract(spent)
                .multiply(HUNDRED)
                .divide(spent, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal cap(BigDecimal value, BigDecimal max) {
        return value.compareTo(max) > 0 ? max : value;
    }
}
