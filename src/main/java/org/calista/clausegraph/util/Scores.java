package org.calista.clausegraph.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Numeric helpers shared by scorers and aggregators.
 *
 * Every score, margin and ratio the solver reports is rounded to {@link #PLACES} decimals at the
 * point where it is produced, so that threshold comparisons are made on the reported values.
 * Rounding works on the exact binary value of the double, not its shortest decimal form.
 */
public final class Scores {

    public static final int PLACES = 6;

    private Scores() {}

    public static double round6(double v) {
        return round(v, PLACES);
    }

    public static double round(double v, int places) {
        if (!Double.isFinite(v)) return v;
        return new BigDecimal(v).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }
}
