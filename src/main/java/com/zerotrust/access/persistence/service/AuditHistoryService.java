package com.zerotrust.access.persistence.service;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.persistence.repository.AuditEventRepository;
import com.zerotrust.access.persistence.repository.DeviceRepository;
import com.zerotrust.access.risk.BusinessHours;
import com.zerotrust.access.risk.history.AuthHistory;
import com.zerotrust.access.risk.history.BehaviorHistory;
import com.zerotrust.access.risk.history.BehaviorProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads the audit log and device table back as authentication history and
 * behavioral baselines.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditHistoryService implements AuthHistory, BehaviorHistory {

    private final AuditEventRepository auditEventRepository;
    private final DeviceRepository deviceRepository;
    private final BusinessHours businessHours;
    private final Clock clock;

    @Value("${zerotrust.session.anomaly.profile-window:P30D}")
    private Duration profileWindow = Duration.ofDays(30);

    @Value("${zerotrust.session.anomaly.default-average-access-count:10}")
    private double defaultAverageAccessCount = BehaviorProfile.DEFAULT_AVERAGE_ACCESS_COUNT;

    @Override
    @Transactional(readOnly = true)
    public long countFailedAttempts(String userId, Instant since) {
        return auditEventRepository.countByUser(userId, EnumSet.of(AuditEventType.AUTH_FAILED), since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countAuthAttempts(String userId, Instant since) {
        return auditEventRepository.countByUser(userId, AuditEventType.AUTH_ATTEMPTS, since);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> knownLocations(String userId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(deviceRepository.findDistinctLocationsByUserId(userId)));
    }

    /**
     * Typical hours are the local hours of the user's successful logins over the
     * profile window. There is no per-session access history yet, so the average
     * access count is the configured baseline.
     */
    @Override
    @Transactional(readOnly = true)
    public BehaviorProfile profile(String userId) {
        Instant since = clock.instant().minus(profileWindow);
        List<Instant> logins = auditEventRepository.findOccurrences(userId, AuditEventType.AUTH_SUCCESS, since);
        Set<Integer> hours = new TreeSet<>();
        for (Instant login : logins) {
            hours.add(businessHours.hourOf(login));
        }
        log.debug("Behavior profile: userId={}, logins={}, typicalHours={}", userId, logins.size(), hours);
        return new BehaviorProfile(Collections.unmodifiableSet(hours), defaultAverageAccessCount);
    }
}
