package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.RiskFactor;
import com.zerotrust.access.domain.RiskFactorType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a scored factor or the reason it could not be scored.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FactorEvaluation {

    RiskFactorType type;
    RiskFactor factor;
    String error;

    public static FactorEvaluation ok(RiskFactor factor) {
        return new FactorEvaluation(factor.getType(), factor, null);
    }

    public static FactorEvaluation failed(RiskFactorType type, String error) {
        return new FactorEvaluation(type, null, error);
    }

    public boolean isOk() {
        return factor != null;
    }
}
