package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import com.zerotrust.access.risk.history.AuthHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Failures in the trailing hour: none 0, one or two 20, three or more 50.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailedAttemptsFactorEvaluator implements RiskFactorEvaluator {

    static final Duration WINDOW = Duration.ofHours(1);

    private final AuthHistory authHistory;

    @Override
    public RiskFactorType type() {
        return RiskFactorType.FAILED_ATTEMPTS;
    }

    @Override
    public FactorEvaluation evaluate(AuthContext context) {
        Instant since = context.getTimestamp().minus(WINDOW);
        long failures;
        try {
            failures = authHistory.countFailedAttempts(context.getUserId(), since);
        } catch (RuntimeException e) {
            log.warn("Failed-attempt count unavailable for user={}: {}", context.getUserId(), e.getMessage());
            return FactorEvaluation.failed(type(), "auth history unavailable: " + e.getMessage());
        }
        double score = failures >= 3 ? 50.0 : failures >= 1 ? 20.0 : 0.0;
        return FactorEvaluation.ok(RiskFactor.of(type(), score, failures + " failed attempts in the last hour"));
    }
}
