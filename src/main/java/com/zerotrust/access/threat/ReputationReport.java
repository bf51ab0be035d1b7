package com.zerotrust.access.threat;

import com.zerotrust.access.domain.ThreatSource;
import lombok.Builder;
import lombok.Value;

/**
 * External reputation of an IP address.
 */
@Value
@Builder
public class ReputationReport {

    String ipAddress;
    int abuseConfidenceScore;
    int totalReports;
    String countryCode;
    String isp;
    boolean whitelisted;
    /** Source name, or {@link ThreatSource#UNAVAILABLE} / {@link ThreatSource#NOT_CONFIGURED}. */
    String source;

    public boolean isDegraded() {
        return ThreatSource.UNAVAILABLE.equals(source);
    }

    public static ReputationReport unavailable(String ipAddress) {
        return ReputationReport.builder().ipAddress(ipAddress).source(ThreatSource.UNAVAILABLE).build();
    }

    public static ReputationReport notConfigured(String ipAddress) {
        return ReputationReport.builder().ipAddress(ipAddress).source(ThreatSource.NOT_CONFIGURED).build();
    }
}
