package com.zerotrust.access.session;

import com.zerotrust.access.domain.ReevaluationAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Action thresholds and reevaluation cadence for live sessions.
 */
@Component
public class ReevaluationRules {

    @Value("${zerotrust.session.revoke-score:90}")
    private double revokeScore = 90;
    @Value("${zerotrust.session.revoke-anomaly-count:3}")
    private int revokeAnomalyCount = 3;
    @Value("${zerotrust.session.stepup-score:70}")
    private double stepupScore = 70;
    @Value("${zerotrust.session.max-risk-increase:30}")
    private double maxRiskIncrease = 30;
    @Value("${zerotrust.session.monitor-score:40}")
    private double monitorScore = 40;

    @Value("${zerotrust.session.interval.high:PT5M}")
    private Duration highRiskInterval = Duration.ofMinutes(5);
    @Value("${zerotrust.session.interval.medium:PT15M}")
    private Duration mediumRiskInterval = Duration.ofMinutes(15);
    @Value("${zerotrust.session.interval.low:PT30M}")
    private Duration lowRiskInterval = Duration.ofMinutes(30);

    /**
     * revoke: score at or above 90, or 3+ anomalies.
     * stepup: score at or above 70, or an increase of more than 30.
     * monitor: score at or above 40, or any anomaly.
     */
    public ReevaluationAction determineAction(double delta, int anomalyCount, double newScore) {
        if (newScore >= revokeScore || anomalyCount >= revokeAnomalyCount) {
            return ReevaluationAction.REVOKE;
        }
        if (newScore >= stepupScore || delta > maxRiskIncrease) {
            return ReevaluationAction.STEPUP;
        }
        if (newScore >= monitorScore || anomalyCount > 0) {
            return ReevaluationAction.MONITOR;
        }
        return ReevaluationAction.NONE;
    }

    public Duration intervalFor(double score) {
        switch (SessionRiskTier.fromScore(score)) {
            case CRITICAL:
            case HIGH:
                return highRiskInterval;
            case MEDIUM:
                return mediumRiskInterval;
            default:
                return lowRiskInterval;
        }
    }
}
