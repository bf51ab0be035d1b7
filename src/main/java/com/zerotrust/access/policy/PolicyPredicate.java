package com.zerotrust.access.policy;

import com.zerotrust.access.domain.AuthContext;

/**
 * One condition of a policy. A policy matches when all of its predicates hold.
 */
public interface PolicyPredicate {

    /** Condition key as stored with the policy, e.g. {@code min_risk_score}. */
    String key();

    /** Value as stored with the policy. */
    Object value();

    boolean test(AuthContext context, double riskScore);
}
