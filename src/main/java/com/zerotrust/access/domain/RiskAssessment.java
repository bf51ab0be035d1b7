package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of scoring an {@link AuthContext}: weighted total, level, the factors
 * keyed by name, and the context snapshot that produced them.
 */
@Value
@Builder
public class RiskAssessment {

    double totalScore;
    RiskLevel level;
    /** Factor name (e.g. "device") to factor, in canonical order. */
    Map<String, RiskFactor> factors;
    AuthContext context;
    Instant evaluatedAt;

    public RiskFactor factor(RiskFactorType type) {
        return factors.get(type.key());
    }

    /**
     * Total = sum of score x weight over the given factors, clamped to [0,100].
     */
    public static RiskAssessment fromFactors(AuthContext context, Collection<RiskFactor> factors, Instant evaluatedAt) {
        Map<String, RiskFactor> byName = new LinkedHashMap<>();
        double total = 0.0;
        for (RiskFactor factor : factors) {
            byName.put(factor.getName(), factor);
            total += factor.getWeightedScore();
        }
        double score = RiskScores.normalize(total);
        return RiskAssessment.builder()
                .totalScore(score)
                .level(RiskLevel.fromScore(score))
                .factors(Collections.unmodifiableMap(byName))
                .context(context)
                .evaluatedAt(evaluatedAt)
                .build();
    }
}
