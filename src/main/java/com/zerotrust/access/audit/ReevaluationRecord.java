package com.zerotrust.access.audit;

import com.zerotrust.access.domain.Anomaly;
import com.zerotrust.access.domain.ReevaluationAction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What the monitor persists after each non-terminal reevaluation.
 */
@Value
@Builder
public class ReevaluationRecord {
    String sessionId;
    String userId;
    double previousScore;
    double currentScore;
    double delta;
    /** Factor name to factor score. */
    Map<String, Double> factorScores;
    List<Anomaly> anomalies;
    ReevaluationAction action;
    Instant reevaluatedAt;
}
