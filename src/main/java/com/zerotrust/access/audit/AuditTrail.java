package com.zerotrust.access.audit;

import java.time.Instant;
import java.util.Set;

/**
 * Durable security event log. Writes never propagate failures into the caller's
 * flow; reads may throw and callers choose their own fallback.
 */
public interface AuditTrail {

    void record(AuditRecord record);

    void recordReevaluation(ReevaluationRecord record);

    long countByIpAddress(String ipAddress, Set<AuditEventType> types, Instant since);
}
