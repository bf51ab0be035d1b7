package com.zerotrust.access.policy;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.PolicyAction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A named, prioritized rule. Lower priority numbers are evaluated first.
 */
@Value
@Builder(toBuilder = true)
public class AccessPolicy {

    String id;
    String name;
    String description;
    int priority;
    List<PolicyPredicate> predicates;
    PolicyAction action;
    boolean enabled;
    Instant createdAt;
    Instant updatedAt;

    /** All predicates hold; a policy without predicates always matches. */
    public boolean matches(AuthContext context, double riskScore) {
        if (predicates == null) return true;
        for (PolicyPredicate predicate : predicates) {
            if (!predicate.test(context, riskScore)) {
                return false;
            }
        }
        return true;
    }
}
