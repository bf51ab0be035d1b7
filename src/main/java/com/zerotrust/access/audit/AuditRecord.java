package com.zerotrust.access.audit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AuditRecord {
    AuditEventType type;
    String userId;
    String sessionId;
    String ipAddress;
    String userAgent;
    @Singular
    Map<String, Object> details;
    Instant occurredAt;
}
