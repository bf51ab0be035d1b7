package com.zerotrust.access.risk.device;

import com.zerotrust.access.domain.DeviceSignature;

import java.time.Instant;
import java.util.Optional;

/**
 * Devices a user has authenticated from, keyed by user and fingerprint.
 */
public interface DeviceRegistry {

    Optional<KnownDevice> findDevice(String userId, String fingerprint);

    /**
     * Creates the device on first sight, otherwise refreshes its last-seen fields.
     */
    KnownDevice recordSeen(String userId, DeviceSignature device, String ipAddress, String location, Instant seenAt);
}
