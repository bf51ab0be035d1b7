package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Resolved location of an IP address. Coordinates are optional; when either is
 * missing, geovelocity checks are skipped for this location.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GeoLocation {

    public static final String UNKNOWN_DISPLAY = "Unknown";

    public static final GeoLocation UNKNOWN = GeoLocation.builder()
            .countryCode(null)
            .city(null)
            .display(UNKNOWN_DISPLAY)
            .build();

    /** ISO 3166-1 alpha-2, or null when unresolved. */
    String countryCode;
    String city;
    String display;
    Double latitude;
    Double longitude;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public boolean isUnknown() {
        return UNKNOWN_DISPLAY.equals(display);
    }

    public static GeoLocation named(String display) {
        return GeoLocation.builder().display(display).build();
    }
}
