package com.zerotrust.access.session;

import com.zerotrust.access.domain.GeoLocation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fresh observations about a live session. Every field is optional; a null IP
 * or user agent means "unchanged". Behavioral checks only run when an access
 * count or a sensitive-resource count is supplied.
 */
@Value
@Builder
public class SessionContextUpdate {

    public static final SessionContextUpdate EMPTY = SessionContextUpdate.builder().build();

    String ipAddress;
    String userAgent;
    /** Pre-resolved location of {@link #ipAddress}; resolved on demand when null. */
    GeoLocation location;
    Instant observedAt;
    Integer accessCount;
    Integer sensitiveResourceAccessCount;

    public boolean hasBehaviorSignals() {
        return accessCount != null || sensitiveResourceAccessCount != null;
    }
}
