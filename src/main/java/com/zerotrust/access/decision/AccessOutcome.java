package com.zerotrust.access.decision;

import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.PolicyAction;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.stepup.IssuedChallenge;
import lombok.Value;

/**
 * Assessment and decision for one attempt, plus the challenge when step-up is required.
 */
@Value
public class AccessOutcome {

    RiskAssessment assessment;
    Decision decision;
    IssuedChallenge challenge;

    public PolicyAction getAction() {
        return decision.getAction();
    }

    public boolean isAllowed() {
        return decision.getAction() == PolicyAction.ALLOW;
    }
}
