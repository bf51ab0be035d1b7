package com.zerotrust.access.domain;

/**
 * The five canonical risk factors and their weights. Weights sum to 1.0.
 */
public enum RiskFactorType {
    DEVICE("device", 0.30),
    LOCATION("location", 0.25),
    TIME("time", 0.20),
    FAILED_ATTEMPTS("failed_attempts", 0.15),
    VELOCITY("velocity", 0.10);

    private final String key;
    private final double weight;

    RiskFactorType(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }
}
