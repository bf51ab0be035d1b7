package com.zerotrust.access.risk.geo;

import com.zerotrust.access.domain.GeoLocation;

/**
 * Resolves an IP address to a location. Implementations return
 * {@link GeoLocation#UNKNOWN} instead of throwing.
 */
public interface GeoLocationService {

    GeoLocation locate(String ipAddress);
}
