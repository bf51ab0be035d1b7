package com.zerotrust.access.risk.context;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.risk.BusinessHours;
import com.zerotrust.access.risk.device.UserAgentParser;
import com.zerotrust.access.risk.geo.GeoLocationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Builds the {@link AuthContext} for an attempt from request identity, IP,
 * raw user agent and time.
 */
@Component
@RequiredArgsConstructor
public class AuthContextFactory {

    private final UserAgentParser userAgentParser;
    private final GeoLocationService geoLocationService;
    private final BusinessHours businessHours;
    private final Clock clock;

    /** Resolves the IP's location through the geolocation service. */
    public AuthContext create(String userId, String ipAddress, String userAgent, Instant timestamp) {
        GeoLocation location = geoLocationService.locate(ipAddress);
        return create(userId, ipAddress, userAgent, location, timestamp);
    }

    /** Uses an already resolved location; makes no external call. */
    public AuthContext create(String userId, String ipAddress, String userAgent, GeoLocation location, Instant timestamp) {
        Instant at = timestamp != null ? timestamp : clock.instant();
        return AuthContext.builder()
                .userId(userId)
                .ipAddress(ipAddress)
                .device(userAgentParser.parse(userAgent))
                .location(location != null ? location : GeoLocation.UNKNOWN)
                .timestamp(at)
                .businessHours(businessHours.isBusinessHours(at))
                .build();
    }
}
