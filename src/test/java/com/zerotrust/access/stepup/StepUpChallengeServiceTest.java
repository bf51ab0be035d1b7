package com.zerotrust.access.stepup;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.SecurityAuditLogger;
import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.domain.PolicyAction;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.domain.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StepUpChallengeServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T14:00:00Z");
    private static final String KEY_PREFIX = "zerotrust:stepup:";

    @Mock
    private RedisTemplate<String, StepUpChallenge> redisTemplate;
    @Mock
    private ValueOperations<String, StepUpChallenge> valueOperations;
    @Mock
    private AuditTrail auditTrail;

    private StepUpChallengeService service;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        service = new StepUpChallengeService(redisTemplate, auditTrail, new SecurityAuditLogger(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RiskAssessment assessment() {
        AuthContext context = AuthContext.builder()
                .userId("user-7")
                .ipAddress("203.0.113.10")
                .device(DeviceSignature.builder()
                        .browserFamily("Firefox")
                        .osFamily("Linux")
                        .rawUserAgent("Mozilla/5.0 (X11; Linux x86_64; rv:123.0) Gecko/20100101 Firefox/123.0")
                        .build())
                .location(GeoLocation.named("Berlin, Germany"))
                .timestamp(NOW)
                .build();
        return RiskAssessment.builder()
                .totalScore(52.0)
                .level(RiskLevel.MEDIUM)
                .factors(Map.of())
                .context(context)
                .evaluatedAt(NOW)
                .build();
    }

    private static Decision stepUpDecision() {
        return Decision.matched(PolicyAction.STEPUP, "Medium Risk - MFA", "Require MFA for medium risk");
    }

    private StepUpChallenge issueAndCapture(IssuedChallenge issued) {
        ArgumentCaptor<StepUpChallenge> stored = ArgumentCaptor.forClass(StepUpChallenge.class);
        verify(valueOperations).set(eq(KEY_PREFIX + issued.getToken()), stored.capture(), eq(Duration.ofMinutes(15)));
        return stored.getValue();
    }

    @Test
    void issueStoresHashedCodeWithTtl() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());

        assertThat(issued.getToken()).isNotBlank().doesNotContain("=").doesNotContain("+").doesNotContain("/");
        assertThat(issued.getCode()).matches("\\d{6}");
        assertThat(issued.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));

        StepUpChallenge challenge = issueAndCapture(issued);
        assertThat(challenge.getCodeHash()).isEqualTo(StepUpChallengeService.sha256(issued.getCode()));
        assertThat(challenge.getCodeHash()).isNotEqualTo(issued.getCode());
        assertThat(challenge.getUserId()).isEqualTo("user-7");
        assertThat(challenge.getLocation()).isEqualTo("Berlin, Germany");
        assertThat(challenge.getPolicyName()).isEqualTo("Medium Risk - MFA");
        assertThat(challenge.getRiskScore()).isEqualTo(52.0);

        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditTrail).record(audit.capture());
        assertThat(audit.getValue().getType()).isEqualTo(AuditEventType.STEPUP_REQUESTED);
        assertThat(audit.getValue().getDetails()).containsEntry("policy", "Medium Risk - MFA");
    }

    @Test
    void tokensAreUniquePerIssue() {
        IssuedChallenge first = service.issue(assessment(), stepUpDecision());
        IssuedChallenge second = service.issue(assessment(), stepUpDecision());

        assertThat(first.getToken()).isNotEqualTo(second.getToken());
    }

    @Test
    void issueFailsWhenStoreIsDown() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), any(StepUpChallenge.class), any(Duration.class));

        assertThatThrownBy(() -> service.issue(assessment(), stepUpDecision()))
                .isInstanceOf(StepUpUnavailableException.class);
        verify(auditTrail, never()).record(any());
    }

    @Test
    void correctCodeVerifiesOnce() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());
        StepUpChallenge challenge = issueAndCapture(issued);
        String key = KEY_PREFIX + issued.getToken();
        when(valueOperations.get(key)).thenReturn(challenge);
        when(redisTemplate.delete(key)).thenReturn(true, false);

        StepUpVerification first = service.verify(issued.getToken(), issued.getCode());
        StepUpVerification second = service.verify(issued.getToken(), issued.getCode());

        assertThat(first.isVerified()).isTrue();
        assertThat(first.getChallenge()).isEqualTo(challenge);
        assertThat(second.getOutcome()).isEqualTo(VerificationOutcome.UNKNOWN_TOKEN);
    }

    @Test
    void codeIsTrimmedBeforeComparison() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());
        StepUpChallenge challenge = issueAndCapture(issued);
        String key = KEY_PREFIX + issued.getToken();
        when(valueOperations.get(key)).thenReturn(challenge);
        when(redisTemplate.delete(key)).thenReturn(true);

        assertThat(service.verify(issued.getToken(), " " + issued.getCode() + "\n").isVerified()).isTrue();
    }

    @Test
    void wrongCodeKeepsChallenge() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());
        StepUpChallenge challenge = issueAndCapture(issued);
        String key = KEY_PREFIX + issued.getToken();
        when(valueOperations.get(key)).thenReturn(challenge);
        when(valueOperations.increment(key + ":failures")).thenReturn(1L);
        String wrong = issued.getCode().equals("000000") ? "111111" : "000000";

        StepUpVerification result = service.verify(issued.getToken(), wrong);

        assertThat(result.getOutcome()).isEqualTo(VerificationOutcome.INVALID_PROOF);
        assertThat(result.getChallenge()).isNull();
        verify(redisTemplate, never()).delete(anyString());
        verify(redisTemplate).expire(key + ":failures", Duration.ofMinutes(15));
    }

    @Test
    void fifthWrongCodeLocksChallenge() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());
        StepUpChallenge challenge = issueAndCapture(issued);
        String key = KEY_PREFIX + issued.getToken();
        when(valueOperations.get(key)).thenReturn(challenge, (StepUpChallenge) null);
        when(valueOperations.increment(key + ":failures")).thenReturn(5L);
        when(redisTemplate.delete(key)).thenReturn(true);
        String wrong = issued.getCode().equals("000000") ? "111111" : "000000";

        StepUpVerification locked = service.verify(issued.getToken(), wrong);
        StepUpVerification afterLock = service.verify(issued.getToken(), issued.getCode());

        assertThat(locked.getOutcome()).isEqualTo(VerificationOutcome.LOCKED);
        assertThat(afterLock.isVerified()).isFalse();
        assertThat(afterLock.getOutcome()).isEqualTo(VerificationOutcome.UNKNOWN_TOKEN);
        verify(redisTemplate).delete(key);
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditTrail, times(2)).record(audit.capture());
        assertThat(audit.getAllValues().get(1).getType()).isEqualTo(AuditEventType.STEPUP_FAILED);
        assertThat(audit.getAllValues().get(1).getDetails()).containsEntry("outcome", "locked");
    }

    @Test
    void failureCounterOutageDiscardsChallenge() {
        IssuedChallenge issued = service.issue(assessment(), stepUpDecision());
        StepUpChallenge challenge = issueAndCapture(issued);
        String key = KEY_PREFIX + issued.getToken();
        when(valueOperations.get(key)).thenReturn(challenge);
        when(valueOperations.increment(key + ":failures")).thenThrow(new RedisConnectionFailureException("down"));
        when(redisTemplate.delete(key)).thenReturn(true);
        String wrong = issued.getCode().equals("000000") ? "111111" : "000000";

        assertThat(service.verify(issued.getToken(), wrong).getOutcome()).isEqualTo(VerificationOutcome.STORE_UNAVAILABLE);
        verify(redisTemplate).delete(key);
    }

    @Test
    void expiredChallengeIsDiscarded() {
        StepUpChallenge expired = StepUpChallenge.builder()
                .token("tok")
                .userId("user-7")
                .codeHash(StepUpChallengeService.sha256("123456"))
                .issuedAt(NOW.minus(Duration.ofMinutes(20)))
                .expiresAt(NOW.minus(Duration.ofMinutes(5)))
                .build();
        when(valueOperations.get(KEY_PREFIX + "tok")).thenReturn(expired);
        when(redisTemplate.delete(KEY_PREFIX + "tok")).thenReturn(true);

        StepUpVerification result = service.verify("tok", "123456");

        assertThat(result.getOutcome()).isEqualTo(VerificationOutcome.EXPIRED);
        verify(redisTemplate).delete(KEY_PREFIX + "tok");
        ArgumentCaptor<AuditRecord> audit = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditTrail).record(audit.capture());
        assertThat(audit.getValue().getType()).isEqualTo(AuditEventType.STEPUP_FAILED);
        assertThat(audit.getValue().getDetails()).containsEntry("outcome", "expired");
    }

    @Test
    void unknownOrBlankTokenIsRejected() {
        when(valueOperations.get(KEY_PREFIX + "missing")).thenReturn(null);

        assertThat(service.verify("missing", "123456").getOutcome()).isEqualTo(VerificationOutcome.UNKNOWN_TOKEN);
        assertThat(service.verify(" ", "123456").getOutcome()).isEqualTo(VerificationOutcome.UNKNOWN_TOKEN);
        assertThat(service.verify(null, "123456").getOutcome()).isEqualTo(VerificationOutcome.UNKNOWN_TOKEN);
    }

    @Test
    void storeFailureDuringVerifyIsNotVerified() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        StepUpVerification result = service.verify("tok", "123456");

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getOutcome()).isEqualTo(VerificationOutcome.STORE_UNAVAILABLE);
    }
}
