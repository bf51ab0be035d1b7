package com.zerotrust.access.threat;

import lombok.Builder;
import lombok.Value;

/**
 * Additional context a caller may supply with a threat check.
 */
@Value
@Builder
public class ThreatContext {

    public static final ThreatContext EMPTY = ThreatContext.builder().build();

    int failedAttempts;
    double locationChangeKm;
    boolean anonymizer;
    /** Requested path or other free text to scan for attack patterns. */
    String requestPath;
}
