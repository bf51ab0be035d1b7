package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one session reevaluation. Terminal results (session not found,
 * already revoked or expired) change nothing and carry only the state found.
 */
@Value
@Builder
public class ReevaluationResult {

    String sessionId;
    String userId;
    /** State after this reevaluation. */
    SessionState state;
    boolean terminal;
    double previousScore;
    double currentScore;
    double delta;
    List<Anomaly> anomalies;
    ReevaluationAction action;
    Confidence confidence;
    Instant reevaluatedAt;
    Instant nextReevaluationAt;

    public boolean isRevoked() {
        return action == ReevaluationAction.REVOKE;
    }

    public static ReevaluationResult terminal(String sessionId, SessionState state, Instant at) {
        return ReevaluationResult.builder()
                .sessionId(sessionId)
                .state(state)
                .terminal(true)
                .anomalies(List.of())
                .action(ReevaluationAction.NONE)
                .confidence(Confidence.LOW)
                .reevaluatedAt(at)
                .build();
    }
}
