package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import com.zerotrust.access.risk.BusinessHours;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Business hours 0, weekday outside business hours 15, weekend 25.
 */
@Component
@RequiredArgsConstructor
public class TimeFactorEvaluator implements RiskFactorEvaluator {

    static final double BUSINESS_HOURS = 0.0;
    static final double WEEKDAY_OFF_HOURS = 15.0;
    static final double WEEKEND = 25.0;

    private final BusinessHours businessHours;

    @Override
    public RiskFactorType type() {
        return RiskFactorType.TIME;
    }

    @Override
    public FactorEvaluation evaluate(AuthContext context) {
        if (context.getTimestamp() == null) {
            return FactorEvaluation.failed(type(), "missing timestamp");
        }
        if (!businessHours.isWeekday(context.getTimestamp())) {
            return FactorEvaluation.ok(RiskFactor.of(type(), WEEKEND, "weekend"));
        }
        if (context.isBusinessHours()) {
            return FactorEvaluation.ok(RiskFactor.of(type(), BUSINESS_HOURS, "business hours"));
        }
        return FactorEvaluation.ok(RiskFactor.of(type(), WEEKDAY_OFF_HOURS, "outside business hours"));
    }
}
