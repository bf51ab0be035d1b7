package com.zerotrust.access.session;

import com.zerotrust.access.domain.Anomaly;
import com.zerotrust.access.domain.AnomalyType;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.domain.MonitoredSession;
import com.zerotrust.access.risk.BusinessHours;
import com.zerotrust.access.risk.history.BehaviorProfile;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AnomalyDetector: geovelocity, drift, identity changes and behavior.
 */
class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-03-13T12:00:00Z");
    private static final GeoLocation LYON = GeoLocation.builder()
            .countryCode("FR").city("Lyon").display("Lyon, FR").latitude(45.7640).longitude(4.8357).build();

    private final AnomalyDetector detector = new AnomalyDetector(new BusinessHours("UTC", 8, 18));

    private static MonitoredSession parisSession(Duration sinceLastContext) {
        return MonitoredSession.builder()
                .id("s-1")
                .userId("user-1")
                .ipAddress("198.51.100.1")
                .userAgent("ua-1")
                .location("Paris, FR")
                .countryCode("FR")
                .latitude(48.8566)
                .longitude(2.3522)
                .createdAt(NOW.minus(Duration.ofHours(8)))
                .lastContextAt(NOW.minus(sinceLastContext))
                .expiresAt(NOW.plus(Duration.ofHours(1)))
                .build();
    }

    private static List<AnomalyType> types(List<Anomaly> anomalies) {
        return anomalies.stream().map(Anomaly::getType).collect(Collectors.toList());
    }

    @Test
    void fastTravelIsImpossibleAndSuppressesDrift() {
        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofMinutes(10)),
                SessionContextUpdate.EMPTY, LYON, BehaviorProfile.EMPTY, NOW);

        assertThat(types(anomalies)).containsExactly(AnomalyType.IMPOSSIBLE_TRAVEL);
        assertThat(anomalies.get(0).getMagnitude()).isGreaterThan(800);
    }

    @Test
    void plausibleTravelOverLongDistanceIsDrift() {
        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofHours(3)),
                SessionContextUpdate.EMPTY, LYON, BehaviorProfile.EMPTY, NOW);

        assertThat(types(anomalies)).containsExactly(AnomalyType.LOCATION_DRIFT);
        assertThat(anomalies.get(0).getMagnitude()).isBetween(380.0, 400.0);
    }

    @Test
    void geovelocityMeasuredFromLastContextNotCreation() {
        // session created 8 hours ago, but last seen in Paris 10 minutes ago
        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofMinutes(10)),
                SessionContextUpdate.EMPTY, LYON, BehaviorProfile.EMPTY, NOW);

        assertThat(types(anomalies)).contains(AnomalyType.IMPOSSIBLE_TRAVEL);
    }

    @Test
    void zeroElapsedTimeOnlyChecksDrift() {
        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ZERO),
                SessionContextUpdate.EMPTY, LYON, BehaviorProfile.EMPTY, NOW);

        assertThat(types(anomalies)).containsExactly(AnomalyType.LOCATION_DRIFT);
    }

    @Test
    void missingCoordinatesSkipLocationChecks() {
        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofMinutes(1)),
                SessionContextUpdate.EMPTY, GeoLocation.named("Lyon, FR"), BehaviorProfile.EMPTY, NOW);

        assertThat(anomalies).isEmpty();
    }

    @Test
    void ipAndUserAgentChanges() {
        SessionContextUpdate update = SessionContextUpdate.builder()
                .ipAddress("203.0.113.50")
                .userAgent("ua-2")
                .build();

        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofMinutes(5)),
                update, null, BehaviorProfile.EMPTY, NOW);

        assertThat(types(anomalies)).containsExactly(AnomalyType.IP_CHANGE, AnomalyType.DEVICE_CHANGE);
    }

    @Test
    void sameIpAndUserAgentAreNotChanges() {
        SessionContextUpdate update = SessionContextUpdate.builder()
                .ipAddress("198.51.100.1")
                .userAgent("ua-1")
                .build();

        assertThat(detector.detect(parisSession(Duration.ofMinutes(5)), update, null, BehaviorProfile.EMPTY, NOW))
                .isEmpty();
    }

    @Test
    void behavioralOutliers() {
        BehaviorProfile profile = new BehaviorProfile(Set.of(8, 9, 10, 11), 10.0);
        SessionContextUpdate update = SessionContextUpdate.builder()
                .accessCount(31)
                .sensitiveResourceAccessCount(6)
                .build();

        List<Anomaly> anomalies = detector.detect(parisSession(Duration.ofMinutes(5)), update, null, profile, NOW);

        assertThat(types(anomalies)).containsExactly(
                AnomalyType.UNUSUAL_HOUR, AnomalyType.EXCESSIVE_ACCESS, AnomalyType.SENSITIVE_ACCESS);
    }

    @Test
    void behaviorWithinBaselineIsQuiet() {
        BehaviorProfile profile = new BehaviorProfile(Set.of(12), 10.0);
        SessionContextUpdate update = SessionContextUpdate.builder()
                .accessCount(30)
                .sensitiveResourceAccessCount(5)
                .build();

        assertThat(detector.detect(parisSession(Duration.ofMinutes(5)), update, null, profile, NOW)).isEmpty();
    }

    @Test
    void behaviorChecksNeedSignals() {
        BehaviorProfile profile = new BehaviorProfile(Set.of(3), 10.0);

        assertThat(detector.detect(parisSession(Duration.ofMinutes(5)), SessionContextUpdate.EMPTY, null, profile, NOW))
                .isEmpty();
    }
}
