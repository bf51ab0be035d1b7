package com.zerotrust.access.threat;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches known scanner tools and attack patterns in the user agent and request
 * context, plus contextual red flags.
 */
@Component
public class ThreatIndicatorDetector {

    static final List<String> SCANNER_TOOLS = List.of(
            "sqlmap", "nikto", "nmap", "masscan", "metasploit", "burp", "dirbuster", "acunetix", "nessus");

    static final List<String> ATTACK_PATTERNS = List.of(
            "admin", "root", "test", "backup", "phpmyadmin", "../", "..\\", "<script", "union select", "drop table");

    static final int FAILED_ATTEMPTS_THRESHOLD = 5;
    static final double LOCATION_CHANGE_KM_THRESHOLD = 1000;

    public List<String> detect(String userAgent, ThreatContext context) {
        List<String> indicators = new ArrayList<>();
        if (userAgent != null && !userAgent.isBlank()) {
            String ua = userAgent.toLowerCase(Locale.ROOT);
            for (String tool : SCANNER_TOOLS) {
                if (ua.contains(tool)) indicators.add("Scanning tool detected: " + tool);
            }
            scanPatterns(ua, indicators);
        }
        if (context != null) {
            if (context.getRequestPath() != null) {
                scanPatterns(context.getRequestPath().toLowerCase(Locale.ROOT), indicators);
            }
            if (context.getFailedAttempts() > FAILED_ATTEMPTS_THRESHOLD) {
                indicators.add("Multiple failed authentication attempts");
            }
            if (context.getLocationChangeKm() > LOCATION_CHANGE_KM_THRESHOLD) {
                indicators.add("Impossible travel detected");
            }
            if (context.isAnonymizer()) {
                indicators.add("Anonymization service detected");
            }
        }
        return indicators;
    }

    private static void scanPatterns(String text, List<String> indicators) {
        for (String pattern : ATTACK_PATTERNS) {
            if (text.contains(pattern)) indicators.add("Suspicious pattern: " + pattern);
        }
    }
}
