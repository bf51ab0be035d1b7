package com.zerotrust.access.persistence.service;

import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.persistence.entity.DeviceEntity;
import com.zerotrust.access.persistence.repository.DeviceRepository;
import com.zerotrust.access.risk.device.DeviceRegistry;
import com.zerotrust.access.risk.device.KnownDevice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaDeviceRegistry implements DeviceRegistry {

    private final DeviceRepository deviceRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<KnownDevice> findDevice(String userId, String fingerprint) {
        return deviceRepository.findByUserIdAndFingerprint(userId, fingerprint).map(JpaDeviceRegistry::toDomain);
    }

    @Override
    @Transactional
    public KnownDevice recordSeen(String userId, DeviceSignature device, String ipAddress, String location, Instant seenAt) {
        String fingerprint = device.getFingerprint();
        DeviceEntity entity = deviceRepository.findByUserIdAndFingerprint(userId, fingerprint)
                .orElseGet(() -> {
                    log.info("Registering new device: userId={}, device={}", userId, device.getDisplayName());
                    return DeviceEntity.builder()
                            .userId(userId)
                            .fingerprint(fingerprint)
                            .deviceType(device.getDeviceType())
                            .browser(device.getBrowserFamily())
                            .os(device.getOsFamily())
                            .firstSeen(seenAt)
                            .build();
                });
        entity.setLastSeen(seenAt);
        entity.setLastSeenIp(ipAddress);
        entity.setLastSeenLocation(location);
        return toDomain(deviceRepository.save(entity));
    }

    static KnownDevice toDomain(DeviceEntity entity) {
        return KnownDevice.builder()
                .userId(entity.getUserId())
                .fingerprint(entity.getFingerprint())
                .deviceType(entity.getDeviceType())
                .browser(entity.getBrowser())
                .os(entity.getOs())
                .firstSeen(entity.getFirstSeen())
                .lastSeen(entity.getLastSeen())
                .lastSeenIp(entity.getLastSeenIp())
                .lastSeenLocation(entity.getLastSeenLocation())
                .build();
    }
}
