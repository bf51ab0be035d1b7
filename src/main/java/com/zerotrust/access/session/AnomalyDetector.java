package com.zerotrust.access.session;

import com.zerotrust.access.domain.Anomaly;
import com.zerotrust.access.domain.AnomalyType;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.domain.MonitoredSession;
import com.zerotrust.access.risk.BusinessHours;
import com.zerotrust.access.risk.geo.GeoDistance;
import com.zerotrust.access.risk.history.BehaviorProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares a session's stored context with an update and reports deviations:
 * geovelocity, location drift, IP and user-agent change, and behavioral outliers.
 */
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private final BusinessHours businessHours;

    @Value("${zerotrust.session.anomaly.max-travel-speed-kmh:800}")
    private double maxTravelSpeedKmh = 800;
    @Value("${zerotrust.session.anomaly.location-drift-km:100}")
    private double locationDriftKm = 100;
    @Value("${zerotrust.session.anomaly.access-count-multiplier:3}")
    private double accessCountMultiplier = 3;
    @Value("${zerotrust.session.anomaly.max-sensitive-access:5}")
    private int maxSensitiveAccess = 5;

    public List<Anomaly> detect(MonitoredSession session, SessionContextUpdate update,
                                GeoLocation newLocation, BehaviorProfile profile, Instant observedAt) {
        List<Anomaly> anomalies = new ArrayList<>();
        detectLocation(session, newLocation, observedAt, anomalies);

        if (update.getIpAddress() != null && !update.getIpAddress().equals(session.getIpAddress())) {
            anomalies.add(Anomaly.of(AnomalyType.IP_CHANGE,
                    "IP changed from " + session.getIpAddress() + " to " + update.getIpAddress()));
        }
        if (update.getUserAgent() != null && !update.getUserAgent().equals(session.getUserAgent())) {
            anomalies.add(Anomaly.of(AnomalyType.DEVICE_CHANGE, "User agent changed during session"));
        }
        if (update.hasBehaviorSignals()) {
            detectBehavior(update, profile, observedAt, anomalies);
        }
        return anomalies;
    }

    private void detectLocation(MonitoredSession session, GeoLocation newLocation, Instant observedAt,
                                List<Anomaly> anomalies) {
        if (newLocation == null || !newLocation.hasCoordinates()
                || session.getLatitude() == null || session.getLongitude() == null) {
            return;
        }
        double distanceKm = GeoDistance.haversineKm(session.getLatitude(), session.getLongitude(),
                newLocation.getLatitude(), newLocation.getLongitude());
        Instant since = session.getLastContextAt() != null ? session.getLastContextAt() : session.getCreatedAt();
        if (since != null) {
            double elapsedHours = Duration.between(since, observedAt).toMillis() / 3_600_000.0;
            // zero or negative elapsed time has no meaningful speed; drift still applies
            if (elapsedHours > 0) {
                double speedKmh = distanceKm / elapsedHours;
                if (speedKmh > maxTravelSpeedKmh) {
                    anomalies.add(Anomaly.of(AnomalyType.IMPOSSIBLE_TRAVEL, String.format(Locale.ROOT,
                            "Impossible travel: %.0f km in %.2f h (%.0f km/h)", distanceKm, elapsedHours, speedKmh),
                            speedKmh));
                    return;
                }
            }
        }
        if (distanceKm > locationDriftKm) {
            anomalies.add(Anomaly.of(AnomalyType.LOCATION_DRIFT, String.format(Locale.ROOT,
                    "Significant location change: %.0f km", distanceKm), distanceKm));
        }
    }

    private void detectBehavior(SessionContextUpdate update, BehaviorProfile profile, Instant observedAt,
                                List<Anomaly> anomalies) {
        int hour = businessHours.hourOf(observedAt);
        if (!profile.getTypicalHours().isEmpty() && !profile.getTypicalHours().contains(hour)) {
            anomalies.add(Anomaly.of(AnomalyType.UNUSUAL_HOUR, "Access at unusual hour " + hour, hour));
        }
        if (update.getAccessCount() != null
                && update.getAccessCount() > profile.getAverageAccessCount() * accessCountMultiplier) {
            anomalies.add(Anomaly.of(AnomalyType.EXCESSIVE_ACCESS,
                    "Access count " + update.getAccessCount() + " far above average "
                            + profile.getAverageAccessCount(), update.getAccessCount()));
        }
        if (update.getSensitiveResourceAccessCount() != null
                && update.getSensitiveResourceAccessCount() > maxSensitiveAccess) {
            anomalies.add(Anomaly.of(AnomalyType.SENSITIVE_ACCESS,
                    "Repeated access to sensitive resources (" + update.getSensitiveResourceAccessCount() + ")",
                    update.getSensitiveResourceAccessCount()));
        }
    }
}
