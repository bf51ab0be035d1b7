package com.zerotrust.access.decision;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.SecurityAuditLogger;
import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.PolicyAction;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.policy.PolicyResolver;
import com.zerotrust.access.risk.context.AuthContextFactory;
import com.zerotrust.access.risk.device.DeviceRegistry;
import com.zerotrust.access.risk.device.UserAgentParser;
import com.zerotrust.access.risk.engine.RiskScorer;
import com.zerotrust.access.stepup.IssuedChallenge;
import com.zerotrust.access.stepup.StepUpChallenge;
import com.zerotrust.access.stepup.StepUpChallengeService;
import com.zerotrust.access.stepup.StepUpUnavailableException;
import com.zerotrust.access.stepup.StepUpVerification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Post-authentication pipeline: context, risk score, policy decision, then the
 * side effects of that decision (audit events, device registration, step-up challenge).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessDecisionService {

    static final String STEPUP_UNAVAILABLE_POLICY = "stepup_unavailable";

    private final AuthContextFactory authContextFactory;
    private final RiskScorer riskScorer;
    private final PolicyResolver policyResolver;
    private final StepUpChallengeService stepUpChallengeService;
    private final DeviceRegistry deviceRegistry;
    private final UserAgentParser userAgentParser;
    private final AuditTrail auditTrail;
    private final SecurityAuditLogger securityAuditLogger;
    private final Clock clock;

    public AccessOutcome decide(AuthenticationAttempt attempt) {
        AuthContext context = authContextFactory.create(attempt.getUserId(), attempt.getIpAddress(),
                attempt.getUserAgent(), attempt.getTimestamp());
        RiskAssessment assessment = riskScorer.evaluate(context);
        Decision decision = policyResolver.evaluate(assessment);

        IssuedChallenge challenge = null;
        if (decision.getAction() == PolicyAction.STEPUP) {
            try {
                challenge = stepUpChallengeService.issue(assessment, decision);
            } catch (StepUpUnavailableException e) {
                log.warn("Step-up required for userId={} but no challenge could be issued; denying", context.getUserId());
                decision = Decision.unmatched(PolicyAction.DENY, STEPUP_UNAVAILABLE_POLICY,
                        "Step-up required but challenge store unavailable");
            }
        }

        securityAuditLogger.logAccessDecision(assessment, decision);
        switch (decision.getAction()) {
            case ALLOW:
                record(AuditEventType.AUTH_SUCCESS, context, assessment, decision);
                registerDevice(context);
                break;
            case DENY:
                record(AuditEventType.ACCESS_DENIED, context, assessment, decision);
                break;
            default:
                // STEPUP_REQUESTED is recorded by the challenge service
                break;
        }
        return new AccessOutcome(assessment, decision, challenge);
    }

    /** Records a credential failure reported by the authentication layer. */
    public void recordFailedAuthentication(AuthenticationAttempt attempt, String reason) {
        Instant at = attempt.getTimestamp() != null ? attempt.getTimestamp() : clock.instant();
        auditTrail.record(AuditRecord.builder()
                .type(AuditEventType.AUTH_FAILED)
                .userId(attempt.getUserId())
                .ipAddress(attempt.getIpAddress())
                .userAgent(attempt.getUserAgent())
                .detail("reason", reason != null ? reason : "invalid_credentials")
                .occurredAt(at)
                .build());
    }

    /**
     * Verifies a step-up proof; on success the attempt counts as a successful
     * authentication and its device is registered.
     */
    public StepUpVerification completeStepUp(String token, String proof) {
        StepUpVerification verification = stepUpChallengeService.verify(token, proof);
        if (verification.isVerified()) {
            StepUpChallenge challenge = verification.getChallenge();
            Instant now = clock.instant();
            auditTrail.record(AuditRecord.builder()
                    .type(AuditEventType.AUTH_SUCCESS)
                    .userId(challenge.getUserId())
                    .ipAddress(challenge.getIpAddress())
                    .userAgent(challenge.getUserAgent())
                    .detail("method", "stepup")
                    .detail("policy", challenge.getPolicyName())
                    .occurredAt(now)
                    .build());
            try {
                deviceRegistry.recordSeen(challenge.getUserId(), userAgentParser.parse(challenge.getUserAgent()),
                        challenge.getIpAddress(), challenge.getLocation(), now);
            } catch (RuntimeException e) {
                log.warn("Could not register device after step-up for userId={}: {}", challenge.getUserId(), e.getMessage());
            }
        }
        return verification;
    }

    private void registerDevice(AuthContext context) {
        try {
            deviceRegistry.recordSeen(context.getUserId(), context.getDevice(), context.getIpAddress(),
                    context.getLocationDisplay(), context.getTimestamp());
        } catch (RuntimeException e) {
            log.warn("Could not register device for userId={}: {}", context.getUserId(), e.getMessage());
        }
    }

    private void record(AuditEventType type, AuthContext context, RiskAssessment assessment, Decision decision) {
        auditTrail.record(AuditRecord.builder()
                .type(type)
                .userId(context.getUserId())
                .ipAddress(context.getIpAddress())
                .userAgent(context.getDevice() != null ? context.getDevice().getRawUserAgent() : null)
                .detail("riskScore", assessment.getTotalScore())
                .detail("riskLevel", assessment.getLevel().name())
                .detail("location", context.getLocationDisplay())
                .detail("action", decision.getAction().value())
                .detail("policy", decision.getPolicyName())
                .occurredAt(context.getTimestamp())
                .build());
    }
}
