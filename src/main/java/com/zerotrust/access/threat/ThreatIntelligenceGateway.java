package com.zerotrust.access.threat;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.domain.Confidence;
import com.zerotrust.access.domain.MonitoredSession;
import com.zerotrust.access.domain.RiskScores;
import com.zerotrust.access.domain.SessionState;
import com.zerotrust.access.domain.ThreatAssessment;
import com.zerotrust.access.domain.ThreatSource;
import com.zerotrust.access.session.SessionLockRegistry;
import com.zerotrust.access.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Blends external IP reputation, the IP's local abuse history and request
 * indicators into a threat score, and applies it as a bounded adjustment to
 * live session scores.
 * <p>
 * score = 0.5 x external + 0.3 x local abuse ratio x 100 + 0.2 x min(indicators x 20, 100)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreatIntelligenceGateway {

    static final Duration LOCAL_WINDOW = Duration.ofDays(30);
    static final int MALICIOUS_THRESHOLD = 70;
    static final int EXTERNAL_ENRICHMENT_THRESHOLD = 50;
    static final int LOCAL_ENRICHMENT_THRESHOLD = 50;
    static final double EXTERNAL_ADJUSTMENT = 20;
    static final double LOCAL_ADJUSTMENT = 15;
    static final double STEP_UP_SCORE = 70;

    private final ReputationClient reputationClient;
    private final IpReputationCache cache;
    private final ThreatIndicatorDetector indicatorDetector;
    private final AuditTrail auditTrail;
    private final SessionStore sessionStore;
    private final SessionLockRegistry locks;
    private final Clock clock;

    /**
     * Cached per IP for the cache TTL; a hit returns the cached assessment unchanged.
     * Results computed while the external source was unavailable are not cached.
     * Without an IP address only the request indicators are scored. Never throws:
     * an unexpected failure yields an unscored, degraded assessment.
     */
    public ThreatAssessment checkIp(String ipAddress, String userAgent, ThreatContext context) {
        try {
            return assess(ipAddress, userAgent, context);
        } catch (RuntimeException e) {
            log.error("Threat check failed for ip={}, returning unscored assessment", ipAddress, e);
            return unscored(ipAddress);
        }
    }

    private ThreatAssessment assess(String ipAddress, String userAgent, ThreatContext context) {
        boolean hasIp = ipAddress != null && !ipAddress.isBlank();
        if (hasIp) {
            Optional<ThreatAssessment> cached = cache.get(ipAddress);
            if (cached.isPresent()) {
                log.debug("Threat cache hit for ip={}", ipAddress);
                return cached.get();
            }
        } else {
            log.warn("Threat check without an IP address; scoring request indicators only");
        }

        ReputationReport external = hasIp ? reputationClient.check(ipAddress) : ReputationReport.unavailable(ipAddress);
        LocalAbuse local = hasIp ? localAbuse(ipAddress) : new LocalAbuse(0, 0);
        List<String> indicators = indicatorDetector.detect(userAgent, context);

        int externalScore = external.getAbuseConfidenceScore();
        int localScore = local.score();
        double indicatorScore = Math.min(indicators.size() * 20, 100);
        int score = (int) RiskScores.clamp(0.5 * externalScore + 0.3 * localScore + 0.2 * indicatorScore);

        ThreatAssessment assessment = ThreatAssessment.builder()
                .ipAddress(ipAddress)
                .score(score)
                .externalScore(externalScore)
                .localScore(localScore)
                .confidence(confidence(external, local, indicators))
                .indicators(List.copyOf(indicators))
                .sources(List.of(
                        new ThreatSource(external.getSource(), externalScore, external.getTotalReports() + " reports"),
                        new ThreatSource(ThreatSource.LOCAL, localScore, local.suspicious() + " suspicious events")))
                .malicious(score >= MALICIOUS_THRESHOLD)
                .recommendation(recommendation(score))
                .checkedAt(clock.instant())
                .build();

        if (external.isDegraded()) {
            log.warn("Threat check for ip={} ran without external reputation; result not cached", ipAddress);
        } else {
            cache.put(ipAddress, assessment);
        }
        auditTrail.record(AuditRecord.builder()
                .type(AuditEventType.THREAT_CHECK)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .detail("threatScore", score)
                .detail("malicious", assessment.isMalicious())
                .detail("confidence", assessment.getConfidence().name())
                .occurredAt(assessment.getCheckedAt())
                .build());
        if (assessment.isMalicious()) {
            log.warn("Malicious IP detected ip={} score={} indicators={}", ipAddress, score, indicators);
        }
        return assessment;
    }

    private ThreatAssessment unscored(String ipAddress) {
        return ThreatAssessment.builder()
                .ipAddress(ipAddress)
                .confidence(Confidence.LOW)
                .indicators(List.of())
                .sources(List.of(new ThreatSource(ThreatSource.UNAVAILABLE, 0, "threat check failed")))
                .recommendation(recommendation(0))
                .checkedAt(clock.instant())
                .build();
    }

    /**
     * Raises an active session's score by +20 when the external abuse score exceeds 50
     * and +15 when the local abuse score exceeds 50, never above 100.
     * Empty when the session is missing, revoked or expired, or when the session
     * store cannot be read or written.
     */
    public Optional<SessionEnrichment> enrichSession(String sessionId) {
        try {
            return enrich(sessionId);
        } catch (RuntimeException e) {
            log.error("Session enrichment failed for sessionId={}", sessionId, e);
            return Optional.empty();
        }
    }

    private Optional<SessionEnrichment> enrich(String sessionId) {
        Optional<MonitoredSession> found = sessionStore.findById(sessionId);
        if (found.isEmpty() || found.get().stateAt(clock.instant()) != SessionState.ACTIVE) {
            return Optional.empty();
        }
        MonitoredSession snapshot = found.get();
        ThreatAssessment threat = checkIp(snapshot.getIpAddress(), snapshot.getUserAgent(), ThreatContext.EMPTY);
        double adjustment = 0;
        if (threat.getExternalScore() > EXTERNAL_ENRICHMENT_THRESHOLD) adjustment += EXTERNAL_ADJUSTMENT;
        if (threat.getLocalScore() > LOCAL_ENRICHMENT_THRESHOLD) adjustment += LOCAL_ADJUSTMENT;
        double appliedAdjustment = adjustment;

        return locks.withLock(sessionId, () -> {
            Optional<MonitoredSession> current = sessionStore.findById(sessionId);
            if (current.isEmpty() || current.get().stateAt(clock.instant()) != SessionState.ACTIVE) {
                return Optional.empty();
            }
            MonitoredSession session = current.get();
            double original = session.getRiskScore();
            double enriched = RiskScores.normalize(original + appliedAdjustment);
            if (enriched != original) {
                sessionStore.save(session.toBuilder().riskScore(enriched).build());
                auditTrail.record(AuditRecord.builder()
                        .type(AuditEventType.SESSION_ENRICHED)
                        .userId(session.getUserId())
                        .sessionId(sessionId)
                        .ipAddress(session.getIpAddress())
                        .detail("originalScore", original)
                        .detail("adjustment", appliedAdjustment)
                        .detail("enrichedScore", enriched)
                        .occurredAt(clock.instant())
                        .build());
                log.info("Session enriched sessionId={} score {} -> {}", sessionId, original, enriched);
            }
            return Optional.of(new SessionEnrichment(sessionId, original, enriched - original, enriched, threat,
                    enriched >= STEP_UP_SCORE ? "step_up_required" : "allow"));
        });
    }

    private LocalAbuse localAbuse(String ipAddress) {
        Instant since = clock.instant().minus(LOCAL_WINDOW);
        try {
            long suspicious = auditTrail.countByIpAddress(ipAddress, AuditEventType.SUSPICIOUS, since);
            long successful = auditTrail.countByIpAddress(ipAddress, AuditEventType.SUCCESSFUL, since);
            return new LocalAbuse(suspicious, successful);
        } catch (RuntimeException e) {
            log.warn("Local abuse history unavailable for ip={}, using 0: {}", ipAddress, e.getMessage());
            return new LocalAbuse(0, 0);
        }
    }

    private static Confidence confidence(ReputationReport external, LocalAbuse local, List<String> indicators) {
        int signals = 0;
        if (external.getTotalReports() > 0) signals++;
        if (local.suspicious() > 0) signals++;
        if (!indicators.isEmpty()) signals++;
        if (signals >= 2) return Confidence.HIGH;
        if (signals == 1) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    static String recommendation(int score) {
        if (score >= 90) return "BLOCK: high threat risk detected";
        if (score >= 70) return "CHALLENGE: step-up authentication required";
        if (score >= 40) return "MONITOR: watch activity closely";
        return "ALLOW: low risk";
    }

    private record LocalAbuse(long suspicious, long successful) {
        /** Suspicious share of all events, as an integer percentage. */
        int score() {
            long total = suspicious + successful;
            return total == 0 ? 0 : (int) (suspicious * 100 / total);
        }
    }
}
