package com.zerotrust.access.domain;

import lombok.Value;

/**
 * One scored factor of an assessment. Score is clamped to [0,100] on creation.
 */
@Value
public class RiskFactor {

    RiskFactorType type;
    double score;
    double weight;
    String detail;

    public static RiskFactor of(RiskFactorType type, double score, String detail) {
        return new RiskFactor(type, RiskScores.clamp(score), type.weight(), detail);
    }

    public String getName() {
        return type.key();
    }

    public double getWeightedScore() {
        return score * weight;
    }
}
