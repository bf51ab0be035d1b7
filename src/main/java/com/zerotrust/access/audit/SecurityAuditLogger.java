package com.zerotrust.access.audit;

import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.ReevaluationResult;
import com.zerotrust.access.domain.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} log line per security decision, alongside the
 * durable {@link AuditTrail}. Log shippers can route these lines to a dedicated
 * retention index.
 */
@Slf4j
@Component
public class SecurityAuditLogger {

    public void logAccessDecision(RiskAssessment assessment, Decision decision) {
        log.info("[AUDIT] ACCESS_DECISION userId={} ip={} location={} score={} level={} action={} policy={} matched={}",
                assessment.getContext().getUserId(),
                assessment.getContext().getIpAddress(),
                assessment.getContext().getLocationDisplay(),
                assessment.getTotalScore(),
                assessment.getLevel(),
                decision.getAction(),
                decision.getPolicyName(),
                decision.isMatched());
    }

    public void logStepUp(String event, String userId, String outcome) {
        log.info("[AUDIT] {} userId={} outcome={}", event, userId, outcome);
    }

    public void logReevaluation(ReevaluationResult result) {
        log.info("[AUDIT] SESSION_REEVALUATED sessionId={} userId={} previousScore={} currentScore={} anomalies={} action={}",
                result.getSessionId(),
                result.getUserId(),
                result.getPreviousScore(),
                result.getCurrentScore(),
                result.getAnomalies().size(),
                result.getAction());
    }

    public void logRevocation(String sessionId, String userId, String reason) {
        log.info("[AUDIT] SESSION_REVOKED sessionId={} userId={} reason={}", sessionId, userId, reason);
    }

    public void logPolicyChange(AuditEventType type, String policyId, String policyName) {
        log.info("[AUDIT] {} policyId={} policyName={}", type, policyId, policyName);
    }
}
