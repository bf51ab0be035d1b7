package com.zerotrust.access.persistence.service;

import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.persistence.entity.DeviceEntity;
import com.zerotrust.access.persistence.repository.DeviceRepository;
import com.zerotrust.access.risk.device.KnownDevice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaDeviceRegistryTest {

    private static final Instant NOW = Instant.parse("2024-03-13T12:00:00Z");

    private final DeviceSignature device = DeviceSignature.builder()
            .browserFamily("Chrome")
            .osFamily("Windows")
            .rawUserAgent("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/122.0.0.0")
            .build();

    @Mock
    private DeviceRepository deviceRepository;

    @InjectMocks
    private JpaDeviceRegistry registry;

    @Test
    void firstSightingCreatesDevice() {
        when(deviceRepository.findByUserIdAndFingerprint("frank", device.getFingerprint())).thenReturn(Optional.empty());
        when(deviceRepository.save(any(DeviceEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        KnownDevice known = registry.recordSeen("frank", device, "198.51.100.8", "Madrid, Spain", NOW);

        assertThat(known.getFingerprint()).isEqualTo(device.getFingerprint());
        assertThat(known.getDeviceType()).isEqualTo(DeviceSignature.DESKTOP);
        assertThat(known.getFirstSeen()).isEqualTo(NOW);
        assertThat(known.getLastSeenLocation()).isEqualTo("Madrid, Spain");
    }

    @Test
    void laterSightingRefreshesLastSeenOnly() {
        Instant firstSeen = NOW.minus(Duration.ofDays(10));
        DeviceEntity existing = DeviceEntity.builder()
                .id("d-1")
                .userId("frank")
                .fingerprint(device.getFingerprint())
                .deviceType(DeviceSignature.DESKTOP)
                .browser("Chrome")
                .os("Windows")
                .firstSeen(firstSeen)
                .lastSeen(firstSeen)
                .lastSeenIp("198.51.100.8")
                .lastSeenLocation("Madrid, Spain")
                .build();
        when(deviceRepository.findByUserIdAndFingerprint("frank", device.getFingerprint())).thenReturn(Optional.of(existing));
        when(deviceRepository.save(existing)).thenReturn(existing);

        KnownDevice known = registry.recordSeen("frank", device, "203.0.113.77", "Seville, Spain", NOW);

        assertThat(known.getFirstSeen()).isEqualTo(firstSeen);
        assertThat(known.getLastSeen()).isEqualTo(NOW);
        assertThat(known.getLastSeenIp()).isEqualTo("203.0.113.77");
        assertThat(known.getLastSeenLocation()).isEqualTo("Seville, Spain");
    }
}
