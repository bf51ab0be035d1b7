package com.zerotrust.access.domain;

import lombok.Value;

/**
 * Output of policy resolution. {@code matched=false} means no enabled policy
 * matched and the documented default was applied.
 */
@Value
public class Decision {

    public static final String DEFAULT_POLICY_NAME = "default";

    PolicyAction action;
    String policyName;
    String description;
    boolean matched;

    public static Decision matched(PolicyAction action, String policyName, String description) {
        return new Decision(action, policyName, description, true);
    }

    /** No enabled policy matched: allow (fail-open). */
    public static Decision defaultAllow() {
        return new Decision(PolicyAction.ALLOW, DEFAULT_POLICY_NAME, "Default policy", false);
    }

    public static Decision unmatched(PolicyAction action, String policyName, String description) {
        return new Decision(action, policyName, description, false);
    }
}
