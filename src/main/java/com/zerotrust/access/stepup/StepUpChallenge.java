package com.zerotrust.access.stepup;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Pending step-up challenge as stored in Redis. Only the SHA-256 of the
 * one-time code is kept.
 */
@Value
@Builder
@Jacksonized
public class StepUpChallenge {
    String token;
    String userId;
    String codeHash;
    String ipAddress;
    String userAgent;
    String location;
    double riskScore;
    String policyName;
    Instant issuedAt;
    Instant expiresAt;
}
