package com.zerotrust.access.domain;

import lombok.Value;

/**
 * Contribution of one reputation source to a threat assessment.
 */
@Value
public class ThreatSource {

    public static final String UNAVAILABLE = "unavailable";
    public static final String NOT_CONFIGURED = "not_configured";
    public static final String LOCAL = "local";

    String name;
    int score;
    String detail;

    public boolean isDegraded() {
        return UNAVAILABLE.equals(name);
    }
}
