package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Facts about a single authentication attempt (or a session's current state)
 * that the risk scorer and policy resolver consume. Immutable per evaluation.
 */
@Value
@Builder(toBuilder = true)
public class AuthContext {

    String userId;
    String ipAddress;
    DeviceSignature device;
    GeoLocation location;
    Instant timestamp;
    boolean businessHours;

    public String getCountryCode() {
        return location != null ? location.getCountryCode() : null;
    }

    public String getLocationDisplay() {
        return location != null ? location.getDisplay() : GeoLocation.UNKNOWN_DISPLAY;
    }

    public String getDeviceType() {
        return device != null ? device.getDeviceType() : null;
    }
}
