package com.zerotrust.access.domain;

import lombok.Value;

/**
 * A single deviation detected between a session's stored context and an update.
 * Magnitude is type specific (km/h, km, counts); 0 where not meaningful.
 */
@Value
public class Anomaly {

    AnomalyType type;
    String description;
    double magnitude;

    public static Anomaly of(AnomalyType type, String description) {
        return new Anomaly(type, description, 0.0);
    }

    public static Anomaly of(AnomalyType type, String description, double magnitude) {
        return new Anomaly(type, description, magnitude);
    }
}
