package com.zerotrust.access.stepup;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.SecurityAuditLogger;
import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Issues and verifies single-use step-up challenges. A challenge is a random
 * URL-safe token plus a six digit code, kept in Redis until verified or expired.
 */
@Slf4j
@Service
public class StepUpChallengeService {

    private static final String KEY_PREFIX = "zerotrust:stepup:";
    private static final String FAILURES_SUFFIX = ":failures";
    private static final int TOKEN_BYTES = 32;

    private final RedisTemplate<String, StepUpChallenge> redisTemplate;
    private final AuditTrail auditTrail;
    private final SecurityAuditLogger securityAuditLogger;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Value("${zerotrust.stepup.ttl:PT15M}")
    private Duration ttl = Duration.ofMinutes(15);

    @Value("${zerotrust.stepup.max-failed-attempts:5}")
    private int maxFailedAttempts = 5;

    public StepUpChallengeService(RedisTemplate<String, StepUpChallenge> redisTemplate,
                                  AuditTrail auditTrail,
                                  SecurityAuditLogger securityAuditLogger,
                                  Clock clock) {
        this.redisTemplate = redisTemplate;
        this.auditTrail = auditTrail;
        this.securityAuditLogger = securityAuditLogger;
        this.clock = clock;
    }

    /**
     * @throws StepUpUnavailableException when the challenge cannot be stored
     */
    public IssuedChallenge issue(RiskAssessment assessment, Decision decision) {
        AuthContext context = assessment.getContext();
        Instant now = clock.instant();
        String token = newToken();
        String code = String.format(Locale.ROOT, "%06d", random.nextInt(1_000_000));
        StepUpChallenge challenge = StepUpChallenge.builder()
                .token(token)
                .userId(context.getUserId())
                .codeHash(sha256(code))
                .ipAddress(context.getIpAddress())
                .userAgent(context.getDevice() != null ? context.getDevice().getRawUserAgent() : null)
                .location(context.getLocationDisplay())
                .riskScore(assessment.getTotalScore())
                .policyName(decision.getPolicyName())
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + token, challenge, ttl);
        } catch (Exception e) {
            log.error("Could not store step-up challenge for userId={}: {}", context.getUserId(), e.getMessage());
            throw new StepUpUnavailableException("Step-up challenge store unavailable", e);
        }
        securityAuditLogger.logStepUp("STEPUP_REQUESTED", context.getUserId(), decision.getPolicyName());
        auditTrail.record(AuditRecord.builder()
                .type(AuditEventType.STEPUP_REQUESTED)
                .userId(context.getUserId())
                .ipAddress(context.getIpAddress())
                .userAgent(challenge.getUserAgent())
                .detail("riskScore", assessment.getTotalScore())
                .detail("policy", decision.getPolicyName())
                .detail("expiresAt", challenge.getExpiresAt().toString())
                .occurredAt(now)
                .build());
        return new IssuedChallenge(token, code, challenge.getExpiresAt());
    }

    /**
     * Verifies the code for a token. A challenge can be verified once; expired
     * challenges are discarded. A wrong code leaves the challenge in place until
     * the configured number of wrong codes is reached, then the challenge is discarded.
     */
    public StepUpVerification verify(String token, String proof) {
        if (token == null || token.isBlank()) {
            return StepUpVerification.failed(VerificationOutcome.UNKNOWN_TOKEN);
        }
        String key = KEY_PREFIX + token;
        StepUpChallenge challenge;
        try {
            challenge = redisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            log.error("Step-up challenge store unavailable while verifying: {}", e.getMessage());
            return StepUpVerification.failed(VerificationOutcome.STORE_UNAVAILABLE);
        }
        if (challenge == null) {
            return StepUpVerification.failed(VerificationOutcome.UNKNOWN_TOKEN);
        }
        Instant now = clock.instant();
        if (!now.isBefore(challenge.getExpiresAt())) {
            delete(key);
            recordOutcome(challenge, AuditEventType.STEPUP_FAILED, "expired", now);
            return StepUpVerification.failed(VerificationOutcome.EXPIRED);
        }
        if (proof == null || !MessageDigest.isEqual(
                sha256(proof.trim()).getBytes(StandardCharsets.UTF_8),
                challenge.getCodeHash().getBytes(StandardCharsets.UTF_8))) {
            return rejectWrongCode(key, challenge, now);
        }
        // the delete decides which concurrent verifier consumes the challenge
        if (!delete(key)) {
            return StepUpVerification.failed(VerificationOutcome.UNKNOWN_TOKEN);
        }
        recordOutcome(challenge, AuditEventType.STEPUP_SUCCESS, "verified", now);
        return new StepUpVerification(VerificationOutcome.VERIFIED, challenge);
    }

    /** The failure counter is a separate key so concurrent guesses are counted atomically. */
    private StepUpVerification rejectWrongCode(String key, StepUpChallenge challenge, Instant now) {
        String failuresKey = key + FAILURES_SUFFIX;
        Long failures;
        try {
            failures = redisTemplate.opsForValue().increment(failuresKey);
            if (failures != null && failures == 1L) {
                redisTemplate.expire(failuresKey, Duration.between(now, challenge.getExpiresAt()));
            }
        } catch (Exception e) {
            log.error("Could not count failed step-up attempt for userId={}, discarding challenge: {}",
                    challenge.getUserId(), e.getMessage());
            delete(key);
            return StepUpVerification.failed(VerificationOutcome.STORE_UNAVAILABLE);
        }
        if (failures != null && failures >= maxFailedAttempts) {
            delete(key);
            log.warn("Step-up challenge locked after {} wrong codes for userId={}", failures, challenge.getUserId());
            recordOutcome(challenge, AuditEventType.STEPUP_FAILED, "locked", now);
            return StepUpVerification.failed(VerificationOutcome.LOCKED);
        }
        recordOutcome(challenge, AuditEventType.STEPUP_FAILED, "invalid_code", now);
        return StepUpVerification.failed(VerificationOutcome.INVALID_PROOF);
    }

    private boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (Exception e) {
            log.warn("Could not delete step-up challenge {}: {}", key, e.getMessage());
            return false;
        }
    }

    private void recordOutcome(StepUpChallenge challenge, AuditEventType type, String outcome, Instant at) {
        securityAuditLogger.logStepUp(type.name(), challenge.getUserId(), outcome);
        auditTrail.record(AuditRecord.builder()
                .type(type)
                .userId(challenge.getUserId())
                .ipAddress(challenge.getIpAddress())
                .userAgent(challenge.getUserAgent())
                .detail("outcome", outcome)
                .occurredAt(at)
                .build());
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
