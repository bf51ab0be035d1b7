package com.zerotrust.access.session;

import com.zerotrust.access.domain.SessionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SessionHealth {
    String sessionId;
    String userId;
    SessionState state;
    boolean active;
    double riskScore;
    SessionRiskTier tier;
    Instant lastReevaluatedAt;
    Instant nextReevaluationAt;
    Instant expiresAt;
    List<String> recommendations;
}
