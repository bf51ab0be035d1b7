package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted multi-factor risk model. Each factor is scored independently; a factor
 * whose collaborator fails is replaced by a neutral score and logged, so evaluation
 * always produces a complete assessment.
 */
@Slf4j
@Service
public class RiskScorer {

    private final Map<RiskFactorType, RiskFactorEvaluator> evaluators = new EnumMap<>(RiskFactorType.class);
    private final Clock clock;

    @Value("${zerotrust.risk.neutral-factor-score:0}")
    private double neutralFactorScore;

    public RiskScorer(List<RiskFactorEvaluator> evaluators, Clock clock) {
        for (RiskFactorEvaluator evaluator : evaluators) {
            if (this.evaluators.put(evaluator.type(), evaluator) != null) {
                throw new IllegalStateException("Duplicate evaluator for factor " + evaluator.type());
            }
        }
        for (RiskFactorType type : RiskFactorType.values()) {
            if (!this.evaluators.containsKey(type)) {
                throw new IllegalStateException("No evaluator registered for factor " + type);
            }
        }
        this.clock = clock;
    }

    public RiskAssessment evaluate(AuthContext context) {
        List<RiskFactor> factors = new ArrayList<>(RiskFactorType.values().length);
        for (RiskFactorType type : RiskFactorType.values()) {
            FactorEvaluation evaluation = run(evaluators.get(type), context);
            if (evaluation.isOk()) {
                factors.add(evaluation.getFactor());
            } else {
                log.warn("Risk factor {} unavailable for user={}, using neutral score {}: {}",
                        type.key(), context.getUserId(), neutralFactorScore, evaluation.getError());
                factors.add(RiskFactor.of(type, neutralFactorScore, "unavailable: " + evaluation.getError()));
            }
        }
        RiskAssessment assessment = RiskAssessment.fromFactors(context, factors, clock.instant());
        log.debug("Risk assessment: user={}, ip={}, score={}, level={}",
                context.getUserId(), context.getIpAddress(), assessment.getTotalScore(), assessment.getLevel());
        return assessment;
    }

    private FactorEvaluation run(RiskFactorEvaluator evaluator, AuthContext context) {
        try {
            return evaluator.evaluate(context);
        } catch (RuntimeException e) {
            log.error("Risk factor evaluator {} threw for user={}", evaluator.type(), context.getUserId(), e);
            return FactorEvaluation.failed(evaluator.type(), e.getClass().getSimpleName());
        }
    }
}
