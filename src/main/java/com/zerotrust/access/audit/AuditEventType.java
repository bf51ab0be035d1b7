package com.zerotrust.access.audit;

import java.util.EnumSet;
import java.util.Set;

public enum AuditEventType {
    AUTH_SUCCESS,
    AUTH_FAILED,
    ACCESS_DENIED,
    SUSPICIOUS_ACTIVITY,
    STEPUP_REQUESTED,
    STEPUP_SUCCESS,
    STEPUP_FAILED,
    SESSION_REVOKED,
    SESSION_ENRICHED,
    THREAT_CHECK,
    POLICY_CREATED,
    POLICY_UPDATED,
    POLICY_DELETED,
    POLICY_TOGGLED;

    /** Events counted as abuse when computing an IP's local abuse ratio. */
    public static final Set<AuditEventType> SUSPICIOUS =
            EnumSet.of(AUTH_FAILED, ACCESS_DENIED, SUSPICIOUS_ACTIVITY, STEPUP_FAILED);

    /** Events counted as legitimate use when computing an IP's local abuse ratio. */
    public static final Set<AuditEventType> SUCCESSFUL = EnumSet.of(AUTH_SUCCESS);

    /** Events that count as an authentication attempt for velocity. */
    public static final Set<AuditEventType> AUTH_ATTEMPTS = EnumSet.of(AUTH_SUCCESS, AUTH_FAILED);
}
