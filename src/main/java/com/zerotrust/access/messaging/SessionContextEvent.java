package com.zerotrust.access.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Context change for a live session, published by the gateway in front of the
 * protected resources.
 */
@Value
@Builder
@Jacksonized
public class SessionContextEvent {
    String sessionId;
    String ipAddress;
    String userAgent;
    Instant observedAt;
    Integer accessCount;
    Integer sensitiveResourceAccessCount;
}
