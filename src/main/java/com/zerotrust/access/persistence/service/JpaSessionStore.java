package com.zerotrust.access.persistence.service;

import com.zerotrust.access.domain.MonitoredSession;
import com.zerotrust.access.persistence.entity.SessionEntity;
import com.zerotrust.access.persistence.repository.SessionRepository;
import com.zerotrust.access.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final SessionRepository sessionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<MonitoredSession> findById(String sessionId) {
        return sessionRepository.findById(sessionId).map(JpaSessionStore::toDomain);
    }

    /**
     * Writes the monitor-owned columns. A row already marked revoked stays revoked
     * even if the incoming snapshot predates the revocation.
     */
    @Override
    @Transactional
    public MonitoredSession save(MonitoredSession session) {
        SessionEntity entity = sessionRepository.findById(session.getId())
                .orElseGet(() -> SessionEntity.builder()
                        .id(session.getId())
                        .userId(session.getUserId())
                        .createdAt(session.getCreatedAt())
                        .expiresAt(session.getExpiresAt())
                        .build());

        entity.setRiskScore(session.getRiskScore());
        entity.setIpAddress(session.getIpAddress());
        entity.setUserAgent(session.getUserAgent());
        entity.setLocation(session.getLocation());
        entity.setCountryCode(session.getCountryCode());
        entity.setLatitude(session.getLatitude());
        entity.setLongitude(session.getLongitude());
        entity.setLastContextAt(session.getLastContextAt());
        entity.setLastReevaluatedAt(session.getLastReevaluatedAt());
        entity.setNextReevaluationAt(session.getNextReevaluationAt());

        if (session.isRevoked() && !entity.isRevoked()) {
            entity.setRevoked(true);
            entity.setRevokedAt(clock.instant());
            entity.setRevocationReason(session.getRevocationReason());
        } else if (!session.isRevoked() && entity.isRevoked()) {
            log.warn("Ignoring attempt to un-revoke session: sessionId={}", session.getId());
        }

        return toDomain(sessionRepository.save(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findActiveSessionIdsAtOrAbove(double threshold, Instant now) {
        return sessionRepository.findActiveIdsAtOrAbove(threshold, now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findDueSessionIds(Instant now, int limit) {
        return sessionRepository.findDueIds(now, PageRequest.of(0, limit));
    }

    static MonitoredSession toDomain(SessionEntity entity) {
        return MonitoredSession.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .riskScore(entity.getRiskScore())
                .ipAddress(entity.getIpAddress())
                .userAgent(entity.getUserAgent())
                .location(entity.getLocation())
                .countryCode(entity.getCountryCode())
                .latitude(entity.getLatitude())
                .longitude(entity.getLongitude())
                .createdAt(entity.getCreatedAt())
                .expiresAt(entity.getExpiresAt())
                .lastContextAt(entity.getLastContextAt())
                .lastReevaluatedAt(entity.getLastReevaluatedAt())
                .nextReevaluationAt(entity.getNextReevaluationAt())
                .revoked(entity.isRevoked())
                .revocationReason(entity.getRevocationReason())
                .build();
    }
}
