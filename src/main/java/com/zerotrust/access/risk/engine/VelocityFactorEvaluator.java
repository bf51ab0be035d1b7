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
 * Authentication attempts (successful or failed) in the last five minutes:
 * more than 5 scores 50, 3 to 5 scores 25, otherwise 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VelocityFactorEvaluator implements RiskFactorEvaluator {

    static final Duration WINDOW = Duration.ofMinutes(5);

    private final AuthHistory authHistory;

    @Override
    public RiskFactorType type() {
        return RiskFactorType.VELOCITY;
    }

    @Override
    public FactorEvaluation evaluate(AuthContext context) {
        Instant since = context.getTimestamp().minus(WINDOW);
        long attempts;
        try {
            attempts = authHistory.countAuthAttempts(context.getUserId(), since);
        } catch (RuntimeException e) {
            log.warn("Velocity count unavailable for user={}: {}", context.getUserId(), e.getMessage());
            return FactorEvaluation.failed(type(), "auth history unavailable: " + e.getMessage());
        }
        double score = attempts > 5 ? 50.0 : attempts >= 3 ? 25.0 : 0.0;
        return FactorEvaluation.ok(RiskFactor.of(type(), score, attempts + " attempts in the last 5 minutes"));
    }
}
