package com.zerotrust.access.decision;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An authentication whose credentials the caller has already verified (or
 * rejected). A null timestamp means now.
 */
@Value
@Builder
public class AuthenticationAttempt {
    String userId;
    String ipAddress;
    String userAgent;
    Instant timestamp;
}
