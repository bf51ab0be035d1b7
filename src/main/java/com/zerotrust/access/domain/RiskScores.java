package com.zerotrust.access.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Score arithmetic shared by factors, assessments and session reevaluation.
 */
public final class RiskScores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private RiskScores() {
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) return MIN;
        return Math.max(MIN, Math.min(MAX, score));
    }

    /** Clamped and rounded half-up to two decimals. */
    public static double normalize(double score) {
        return round(clamp(score));
    }

    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
