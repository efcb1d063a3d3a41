package mgnrega.tracker.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MetricMath {

    private MetricMath() {
    }

    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Percent change from previous to current, 0 when there is no meaningful base.
     */
    public static double percentChange(double current, double previous) {
        if (previous == 0) {
            return 0;
        }
        return (current - previous) / previous * 100;
    }
}
