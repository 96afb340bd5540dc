package com.eainde.cds.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived ratio helpers shared by the section records.
 */
public final class Rates {

    static final int SCALE = 4;

    private Rates() {}

    /**
     * {@code numerator / denominator} rounded to four decimals, or 0 when either operand is
     * not positive or the ratio exceeds 1.
     */
    public static double ratio(int numerator, int denominator) {
        if (numerator <= 0 || denominator <= 0 || numerator > denominator) return 0.0;
        return round((double) numerator / denominator);
    }

    /**
     * @return true when the value is a usable rate: strictly positive and at most 1
     */
    public static boolean isRate(Double value) {
        return value != null && value > 0 && value <= 1;
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
