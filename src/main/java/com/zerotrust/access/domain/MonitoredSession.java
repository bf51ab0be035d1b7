package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a session row as the monitor sees it. Updates produce a new
 * instance via {@code toBuilder()} and are written back through the session store.
 */
@Value
@Builder(toBuilder = true)
public class MonitoredSession {

    String id;
    String userId;
    double riskScore;
    String ipAddress;
    String userAgent;
    String location;
    String countryCode;
    Double latitude;
    Double longitude;
    Instant createdAt;
    Instant expiresAt;
    Instant lastContextAt;
    Instant lastReevaluatedAt;
    Instant nextReevaluationAt;
    boolean revoked;
    String revocationReason;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public SessionState stateAt(Instant now) {
        if (revoked) return SessionState.REVOKED;
        if (isExpired(now)) return SessionState.EXPIRED;
        return SessionState.ACTIVE;
    }

    public GeoLocation geoLocation() {
        return GeoLocation.builder()
                .display(location != null ? location : GeoLocation.UNKNOWN_DISPLAY)
                .countryCode(countryCode)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }
}
