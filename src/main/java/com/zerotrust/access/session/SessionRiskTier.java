package com.zerotrust.access.session;

public enum SessionRiskTier {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static SessionRiskTier fromScore(double score) {
        if (score >= 90) return CRITICAL;
        if (score >= 70) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }
}
