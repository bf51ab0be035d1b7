package com.zerotrust.access.risk.device;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class KnownDevice {
    String userId;
    String fingerprint;
    String deviceType;
    String browser;
    String os;
    Instant firstSeen;
    Instant lastSeen;
    String lastSeenIp;
    String lastSeenLocation;
}
