package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.RiskFactorType;

/**
 * Scores one factor of an authentication context. Implementations report
 * collaborator failures through {@link FactorEvaluation#failed} and never throw.
 */
public interface RiskFactorEvaluator {

    RiskFactorType type();

    FactorEvaluation evaluate(AuthContext context);
}
