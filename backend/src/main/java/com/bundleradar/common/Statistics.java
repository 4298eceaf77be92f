package com.bundleradar.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Small numeric helpers shared by the scoring stages.
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * Sample standard deviation (Bessel's correction) divided by |mean|.
     * Returns 0 for fewer than two values or a zero mean.
     */
    public static double coefficientOfVariation(Collection<? extends Number> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (Number v : values) {
            sum += v.doubleValue();
        }
        double mean = sum / values.size();
        if (mean == 0.0) {
            return 0.0;
        }
        double squares = 0.0;
        for (Number v : values) {
            double d = v.doubleValue() - mean;
            squares += d * d;
        }
        double variance = squares / (values.size() - 1);
        return Math.sqrt(variance) / Math.abs(mean);
    }

    public static double mean(Collection<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Number v : values) {
            sum += v.doubleValue();
        }
        return sum / values.size();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Half-up rounding to the given number of decimal places. NaN and infinities pass through.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
