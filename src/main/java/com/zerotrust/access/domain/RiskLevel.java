package com.zerotrust.access.domain;

/**
 * Risk band of a total score: low below 40, medium 40 to below 75, high from 75.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_THRESHOLD = 40.0;
    public static final double HIGH_THRESHOLD = 75.0;

    public static RiskLevel fromScore(double score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
