package com.zerotrust.access.risk.history;

import lombok.Value;

import java.util.Set;

/**
 * A user's baseline: hours of day they usually authenticate in and their
 * average per-session access count.
 */
@Value
public class BehaviorProfile {

    public static final double DEFAULT_AVERAGE_ACCESS_COUNT = 10.0;

    public static final BehaviorProfile EMPTY = new BehaviorProfile(Set.of(), DEFAULT_AVERAGE_ACCESS_COUNT);

    Set<Integer> typicalHours;
    double averageAccessCount;
}
