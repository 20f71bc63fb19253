package com.premiergroup.ad_delivery_engine.util;

import com.premiergroup.ad_delivery_engine.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between currency units and the micros every entity stores.
 */
public final class Micros {

    public static final long PER_UNIT = 1_000_000L;

    private Micros() {
    }

    public static long fromUnits(BigDecimal units) {
        if (units == null) {
            return 0L;
        }
        try {
            return units.movePointRight(6).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount out of range: " + units.toPlainString());
        }
    }

    public static Long fromUnitsNullable(BigDecimal units) {
        return units == null ? null : fromUnits(units);
    }

    public static BigDecimal toUnits(long micros) {
        return BigDecimal.valueOf(micros, 6);
    }

    public static BigDecimal toUnitsNullable(Long micros) {
        return micros == null ? null : toUnits(micros);
    }
}
