package com.zerotrust.access.risk.device;

import com.zerotrust.access.domain.DeviceSignature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ua_parser.Client;
import ua_parser.Parser;

import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw user agent into a {@link DeviceSignature} using the ua-parser regex set.
 * Unparseable input yields the "Other" families rather than an error.
 */
@Slf4j
@Component
public class UserAgentParser {

    static final String OTHER = "Other";

    private static final Set<String> MOBILE_OS = Set.of(
            "iOS", "Android", "Windows Phone", "BlackBerry OS", "Symbian OS", "Firefox OS", "KaiOS");

    private final Parser parser;

    public UserAgentParser() {
        this.parser = new Parser();
    }

    public DeviceSignature parse(String userAgent) {
        String raw = userAgent != null ? userAgent : "";
        String browser = OTHER;
        String os = OTHER;
        String deviceFamily = OTHER;
        if (!raw.isBlank()) {
            try {
                Client client = parser.parse(raw);
                browser = familyOrOther(client.userAgent != null ? client.userAgent.family : null);
                os = familyOrOther(client.os != null ? client.os.family : null);
                deviceFamily = familyOrOther(client.device != null ? client.device.family : null);
            } catch (RuntimeException e) {
                log.warn("User agent could not be parsed, treating as unknown: {}", e.getMessage());
            }
        }
        return DeviceSignature.builder()
                .browserFamily(browser)
                .osFamily(os)
                .mobile(isMobile(os, deviceFamily, raw))
                .rawUserAgent(raw)
                .build();
    }

    private static boolean isMobile(String os, String deviceFamily, String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        if ("iPad".equals(deviceFamily) || lower.contains("tablet")) return false;
        return MOBILE_OS.contains(os) || lower.contains("mobi");
    }

    private static String familyOrOther(String family) {
        return family == null || family.isBlank() ? OTHER : family;
    }
}
