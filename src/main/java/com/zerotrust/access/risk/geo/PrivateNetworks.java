package com.zerotrust.access.risk.geo;

import com.zerotrust.access.domain.GeoLocation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loopback, RFC 1918, link-local and unspecified addresses resolve locally
 * without a geolocation lookup.
 */
public final class PrivateNetworks {

    public static final String LOCALHOST = "Localhost";
    public static final String LOCAL_NETWORK = "Local Network";

    private static final Pattern LOOPBACK = Pattern.compile("^(127\\.|0\\.0\\.0\\.0).*");
    private static final Pattern PRIVATE_IPV4 = Pattern.compile(
            "^(10\\.|192\\.168\\.|172\\.(1[6-9]|2\\d|3[0-1])\\.|169\\.254\\.).*");

    private PrivateNetworks() {
    }

    public static boolean isLoopback(String ip) {
        if (ip == null) return false;
        String trimmed = ip.trim();
        return "::1".equals(trimmed) || "localhost".equalsIgnoreCase(trimmed) || LOOPBACK.matcher(trimmed).matches();
    }

    public static boolean isPrivate(String ip) {
        if (ip == null || ip.isBlank()) return false;
        return isLoopback(ip) || PRIVATE_IPV4.matcher(ip.trim()).matches();
    }

    public static Optional<GeoLocation> localLocation(String ip) {
        if (isLoopback(ip)) return Optional.of(GeoLocation.named(LOCALHOST));
        if (isPrivate(ip)) return Optional.of(GeoLocation.named(LOCAL_NETWORK));
        return Optional.empty();
    }
}
