package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Parsed view of a raw user agent: browser family, OS family and form factor.
 * The fingerprint is what the device registry is keyed on.
 */
@Value
@Builder
@Jacksonized
public class DeviceSignature {

    public static final String MOBILE = "mobile";
    public static final String DESKTOP = "desktop";

    private static final int FINGERPRINT_UA_PREFIX = 50;

    String browserFamily;
    String osFamily;
    boolean mobile;
    String rawUserAgent;

    public String getDeviceType() {
        return mobile ? MOBILE : DESKTOP;
    }

    /** browser + "_" + os + "_" + first 50 chars of the raw user agent. */
    public String getFingerprint() {
        String ua = rawUserAgent != null ? rawUserAgent : "";
        String prefix = ua.length() > FINGERPRINT_UA_PREFIX ? ua.substring(0, FINGERPRINT_UA_PREFIX) : ua;
        return browserFamily + "_" + osFamily + "_" + prefix;
    }

    public String getDisplayName() {
        return browserFamily + " on " + osFamily;
    }
}
