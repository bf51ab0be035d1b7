package com.zerotrust.access.session;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.ReevaluationRecord;
import com.zerotrust.access.audit.SecurityAuditLogger;
import com.zerotrust.access.domain.Anomaly;
import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.Confidence;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.domain.MonitoredSession;
import com.zerotrust.access.domain.ReevaluationAction;
import com.zerotrust.access.domain.ReevaluationResult;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskScores;
import com.zerotrust.access.domain.SessionState;
import com.zerotrust.access.messaging.ReevaluationEventProducer;
import com.zerotrust.access.risk.context.AuthContextFactory;
import com.zerotrust.access.risk.engine.RiskScorer;
import com.zerotrust.access.risk.geo.GeoLocationService;
import com.zerotrust.access.risk.history.BehaviorHistory;
import com.zerotrust.access.risk.history.BehaviorProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Reevaluates live sessions as their context drifts: detects anomalies, rescores
 * with the login risk model plus an anomaly penalty, and keeps, escalates or
 * revokes the session.
 * <p>
 * Work on one session is serialized through {@link SessionLockRegistry}. External
 * lookups (geolocation, behavior history) run before the lock is taken, and the
 * session is re-read under the lock so a concurrent revocation is never undone.
 */
@Slf4j
@Service
public class SessionMonitor {

    static final Duration EXPIRY_WARNING = Duration.ofMinutes(5);

    private final SessionStore sessionStore;
    private final AnomalyDetector anomalyDetector;
    private final RiskScorer riskScorer;
    private final AuthContextFactory authContextFactory;
    private final GeoLocationService geoLocationService;
    private final BehaviorHistory behaviorHistory;
    private final ReevaluationRules rules;
    private final SessionLockRegistry locks;
    private final AuditTrail auditTrail;
    private final SecurityAuditLogger securityAuditLogger;
    private final ReevaluationEventProducer eventProducer;
    private final Executor reevaluationExecutor;
    private final Clock clock;

    @Value("${zerotrust.session.anomaly-penalty:10}")
    private double anomalyPenalty = 10;

    @Value("${zerotrust.session.due-batch-size:500}")
    private int dueBatchSize = 500;

    public SessionMonitor(SessionStore sessionStore,
                          AnomalyDetector anomalyDetector,
                          RiskScorer riskScorer,
                          AuthContextFactory authContextFactory,
                          GeoLocationService geoLocationService,
                          BehaviorHistory behaviorHistory,
                          ReevaluationRules rules,
                          SessionLockRegistry locks,
                          AuditTrail auditTrail,
                          SecurityAuditLogger securityAuditLogger,
                          ReevaluationEventProducer eventProducer,
                          @Qualifier("reevaluationExecutor") Executor reevaluationExecutor,
                          Clock clock) {
        this.sessionStore = sessionStore;
        this.anomalyDetector = anomalyDetector;
        this.riskScorer = riskScorer;
        this.authContextFactory = authContextFactory;
        this.geoLocationService = geoLocationService;
        this.behaviorHistory = behaviorHistory;
        this.rules = rules;
        this.locks = locks;
        this.auditTrail = auditTrail;
        this.securityAuditLogger = securityAuditLogger;
        this.eventProducer = eventProducer;
        this.reevaluationExecutor = reevaluationExecutor;
        this.clock = clock;
    }

    /**
     * Reevaluates one session. Absent, revoked and expired sessions yield a terminal
     * result; nothing here throws.
     */
    public ReevaluationResult reevaluate(String sessionId, SessionContextUpdate update) {
        SessionContextUpdate change = update != null ? update : SessionContextUpdate.EMPTY;
        Instant now = clock.instant();
        MonitoredSession snapshot;
        try {
            Optional<MonitoredSession> found = sessionStore.findById(sessionId);
            if (found.isEmpty()) {
                return ReevaluationResult.terminal(sessionId, SessionState.NOT_FOUND, now);
            }
            snapshot = found.get();
        } catch (RuntimeException e) {
            log.error("Session store unavailable, skipping reevaluation of sessionId={}", sessionId, e);
            return ReevaluationResult.terminal(sessionId, SessionState.UNAVAILABLE, now);
        }
        SessionState state = snapshot.stateAt(now);
        if (state.isTerminal()) {
            log.debug("Session {} is {}, nothing to reevaluate", sessionId, state);
            return ReevaluationResult.terminal(sessionId, state, now);
        }

        GeoLocation location = resolveLocation(snapshot, change);
        BehaviorProfile profile = change.hasBehaviorSignals() ? loadProfile(snapshot.getUserId()) : BehaviorProfile.EMPTY;

        ReevaluationResult result;
        try {
            result = locks.withLock(sessionId, () -> reevaluateLocked(sessionId, change, location, profile));
        } catch (RuntimeException e) {
            log.error("Reevaluation of sessionId={} failed, session left unchanged", sessionId, e);
            return ReevaluationResult.terminal(sessionId, SessionState.UNAVAILABLE, now);
        }
        if (!result.isTerminal()) {
            securityAuditLogger.logReevaluation(result);
            eventProducer.send(result);
        }
        return result;
    }

    private ReevaluationResult reevaluateLocked(String sessionId, SessionContextUpdate change,
                                                GeoLocation location, BehaviorProfile profile) {
        Instant now = clock.instant();
        Optional<MonitoredSession> current = sessionStore.findById(sessionId);
        if (current.isEmpty()) {
            return ReevaluationResult.terminal(sessionId, SessionState.NOT_FOUND, now);
        }
        MonitoredSession session = current.get();
        SessionState state = session.stateAt(now);
        if (state.isTerminal()) {
            return ReevaluationResult.terminal(sessionId, state, now);
        }

        Instant observedAt = change.getObservedAt() != null ? change.getObservedAt() : now;
        List<Anomaly> anomalies = anomalyDetector.detect(session, change, location, profile, observedAt);

        String ip = change.getIpAddress() != null ? change.getIpAddress() : session.getIpAddress();
        String userAgent = change.getUserAgent() != null ? change.getUserAgent() : session.getUserAgent();
        AuthContext context = authContextFactory.create(session.getUserId(), ip, userAgent, location, observedAt);
        RiskAssessment assessment = riskScorer.evaluate(context);

        double previousScore = session.getRiskScore();
        double currentScore = RiskScores.normalize(assessment.getTotalScore() + anomalyPenalty * anomalies.size());
        double delta = RiskScores.round(currentScore - previousScore);
        ReevaluationAction action = rules.determineAction(delta, anomalies.size(), currentScore);
        boolean revoke = action == ReevaluationAction.REVOKE;
        Instant next = revoke ? null : now.plus(rules.intervalFor(currentScore));

        MonitoredSession.MonitoredSessionBuilder updated = session.toBuilder()
                .riskScore(currentScore)
                .ipAddress(ip)
                .userAgent(userAgent)
                .lastContextAt(observedAt)
                .lastReevaluatedAt(now)
                .nextReevaluationAt(next);
        if (location != null && !location.isUnknown()) {
            updated.location(location.getDisplay())
                    .countryCode(location.getCountryCode())
                    .latitude(location.getLatitude())
                    .longitude(location.getLongitude());
        }
        if (revoke) {
            updated.revoked(true).revocationReason(revocationReason(currentScore, anomalies));
        }
        sessionStore.save(updated.build());

        ReevaluationResult result = ReevaluationResult.builder()
                .sessionId(sessionId)
                .userId(session.getUserId())
                .state(revoke ? SessionState.REVOKED : SessionState.ACTIVE)
                .previousScore(previousScore)
                .currentScore(currentScore)
                .delta(delta)
                .anomalies(List.copyOf(anomalies))
                .action(action)
                .confidence(confidenceOf(anomalies.size()))
                .reevaluatedAt(now)
                .nextReevaluationAt(next)
                .build();

        auditTrail.recordReevaluation(ReevaluationRecord.builder()
                .sessionId(sessionId)
                .userId(session.getUserId())
                .previousScore(previousScore)
                .currentScore(currentScore)
                .delta(delta)
                .factorScores(factorScores(assessment))
                .anomalies(result.getAnomalies())
                .action(action)
                .reevaluatedAt(now)
                .build());
        if (revoke) {
            recordRevocation(session, revocationReason(currentScore, anomalies), now);
        }
        return result;
    }

    /**
     * Marks the session revoked. Revoking an already revoked session is a no-op
     * that reports {@link SessionState#REVOKED} again.
     */
    public SessionState revoke(String sessionId, String reason) {
        return locks.withLock(sessionId, () -> {
            Instant now = clock.instant();
            Optional<MonitoredSession> found = sessionStore.findById(sessionId);
            if (found.isEmpty()) {
                return SessionState.NOT_FOUND;
            }
            MonitoredSession session = found.get();
            if (session.isRevoked()) {
                return SessionState.REVOKED;
            }
            sessionStore.save(session.toBuilder()
                    .revoked(true)
                    .revocationReason(reason)
                    .nextReevaluationAt(null)
                    .build());
            recordRevocation(session, reason, now);
            return SessionState.REVOKED;
        });
    }

    /** Reevaluates every active session whose score is at or above the threshold. */
    public BatchReevaluationReport batchReevaluate(double threshold) {
        List<String> sessionIds;
        try {
            sessionIds = sessionStore.findActiveSessionIdsAtOrAbove(threshold, clock.instant());
        } catch (RuntimeException e) {
            log.error("Could not list sessions for batch reevaluation (threshold={})", threshold, e);
            return BatchReevaluationReport.empty();
        }
        log.info("Batch reevaluation of {} sessions at or above score {}", sessionIds.size(), threshold);
        return runBatch(sessionIds);
    }

    /** Reevaluates every active session whose next reevaluation time has passed. */
    public BatchReevaluationReport reevaluateDue() {
        List<String> sessionIds;
        try {
            sessionIds = sessionStore.findDueSessionIds(clock.instant(), dueBatchSize);
        } catch (RuntimeException e) {
            log.error("Could not list sessions due for reevaluation", e);
            return BatchReevaluationReport.empty();
        }
        if (!sessionIds.isEmpty()) {
            log.info("{} sessions due for reevaluation", sessionIds.size());
        }
        return runBatch(sessionIds);
    }

    /**
     * Empty for an unknown session. When the store cannot be read the report has
     * state {@link SessionState#UNAVAILABLE} and no score.
     */
    public Optional<SessionHealth> health(String sessionId) {
        Instant now = clock.instant();
        Optional<MonitoredSession> found;
        try {
            found = sessionStore.findById(sessionId);
        } catch (RuntimeException e) {
            log.error("Session store unavailable, no health report for sessionId={}", sessionId, e);
            return Optional.of(SessionHealth.builder()
                    .sessionId(sessionId)
                    .state(SessionState.UNAVAILABLE)
                    .active(false)
                    .recommendations(List.of("Session store unavailable, retry later"))
                    .build());
        }
        return found.map(session -> {
            SessionState state = session.stateAt(now);
            SessionRiskTier tier = SessionRiskTier.fromScore(session.getRiskScore());
            List<String> recommendations = new ArrayList<>();
            if (session.isRevoked()) {
                recommendations.add("Session revoked, re-authentication required");
            } else if (session.getRiskScore() >= 70) {
                recommendations.add("Step-up authentication required");
            } else if (session.getRiskScore() >= 40) {
                recommendations.add("Monitor activity closely");
            }
            if (state == SessionState.ACTIVE && session.getExpiresAt() != null
                    && session.getExpiresAt().isBefore(now.plus(EXPIRY_WARNING))) {
                recommendations.add("Session about to expire");
            }
            return SessionHealth.builder()
                    .sessionId(session.getId())
                    .userId(session.getUserId())
                    .state(state)
                    .active(state == SessionState.ACTIVE)
                    .riskScore(session.getRiskScore())
                    .tier(tier)
                    .lastReevaluatedAt(session.getLastReevaluatedAt() != null
                            ? session.getLastReevaluatedAt() : session.getCreatedAt())
                    .nextReevaluationAt(session.getNextReevaluationAt())
                    .expiresAt(session.getExpiresAt())
                    .recommendations(recommendations)
                    .build();
        });
    }

    private BatchReevaluationReport runBatch(List<String> sessionIds) {
        List<CompletableFuture<ReevaluationResult>> futures = new ArrayList<>(sessionIds.size());
        int failed = 0;
        for (String sessionId : sessionIds) {
            try {
                futures.add(CompletableFuture.supplyAsync(
                        () -> reevaluate(sessionId, SessionContextUpdate.EMPTY), reevaluationExecutor));
            } catch (RejectedExecutionException e) {
                failed++;
                log.warn("Reevaluation pool saturated, sessionId={} skipped this round", sessionId);
            }
        }
        List<ReevaluationResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ReevaluationResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                failed++;
                log.error("Reevaluation task failed", e.getCause());
            }
        }
        return new BatchReevaluationReport(sessionIds.size(), failed, results);
    }

    private GeoLocation resolveLocation(MonitoredSession session, SessionContextUpdate change) {
        if (change.getLocation() != null) {
            return change.getLocation();
        }
        if (change.getIpAddress() != null && !change.getIpAddress().equals(session.getIpAddress())) {
            return geoLocationService.locate(change.getIpAddress());
        }
        return session.geoLocation();
    }

    private BehaviorProfile loadProfile(String userId) {
        try {
            return behaviorHistory.profile(userId);
        } catch (RuntimeException e) {
            log.warn("Behavior history unavailable for userId={}, using empty profile: {}", userId, e.getMessage());
            return BehaviorProfile.EMPTY;
        }
    }

    private void recordRevocation(MonitoredSession session, String reason, Instant at) {
        securityAuditLogger.logRevocation(session.getId(), session.getUserId(), reason);
        auditTrail.record(AuditRecord.builder()
                .type(AuditEventType.SESSION_REVOKED)
                .userId(session.getUserId())
                .sessionId(session.getId())
                .ipAddress(session.getIpAddress())
                .detail("reason", reason)
                .occurredAt(at)
                .build());
    }

    private static String revocationReason(double score, List<Anomaly> anomalies) {
        return "reevaluation: score=" + score + ", anomalies=" + anomalies.size();
    }

    private static Confidence confidenceOf(int anomalyCount) {
        if (anomalyCount >= 2) return Confidence.HIGH;
        if (anomalyCount == 1) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    private static Map<String, Double> factorScores(RiskAssessment assessment) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (RiskFactor factor : assessment.getFactors().values()) {
            scores.put(factor.getName(), factor.getScore());
        }
        return scores;
    }
}
