package com.zerotrust.access.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Reputation view of an IP address combining external, local and
 * user-agent indicators. Score is an integer in [0,100].
 */
@Value
@Builder
public class ThreatAssessment {

    String ipAddress;
    int score;
    int externalScore;
    int localScore;
    Confidence confidence;
    List<String> indicators;
    List<ThreatSource> sources;
    boolean malicious;
    String recommendation;
    Instant checkedAt;

    /** True when the external source could not be reached for this assessment. */
    public boolean isDegraded() {
        return sources != null && sources.stream().anyMatch(ThreatSource::isDegraded);
    }
}
