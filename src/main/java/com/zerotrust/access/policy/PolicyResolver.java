package com.zerotrust.access.policy;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.Decision;
import com.zerotrust.access.domain.PolicyAction;
import com.zerotrust.access.domain.RiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * First-match-wins policy evaluation. Enabled policies are ordered by ascending
 * priority, ties broken by ascending name, so the outcome does not depend on
 * storage iteration order. No match yields {@link Decision#defaultAllow()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyResolver {

    public static final Comparator<AccessPolicy> EVALUATION_ORDER = Comparator
            .comparingInt(AccessPolicy::getPriority)
            .thenComparing(AccessPolicy::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    static final String STORE_UNAVAILABLE = "policy_store_unavailable";

    private final PolicyStore policyStore;
    private final DefaultPolicySeeder seeder;

    /** Decision when the policy store itself cannot be read: allow (fail-open) unless configured otherwise. */
    @Value("${zerotrust.policy.fail-open-on-store-error:true}")
    private boolean failOpenOnStoreError;

    public Decision evaluate(RiskAssessment assessment) {
        List<AccessPolicy> policies;
        try {
            policies = policyStore.findEnabled();
            if (policies.isEmpty()) {
                policies = seedDefaults();
            }
        } catch (RuntimeException e) {
            log.error("Policy store unavailable for user={}, failOpen={}",
                    assessment.getContext().getUserId(), failOpenOnStoreError, e);
            return failOpenOnStoreError
                    ? Decision.unmatched(PolicyAction.ALLOW, Decision.DEFAULT_POLICY_NAME, "Policy store unavailable")
                    : Decision.unmatched(PolicyAction.DENY, STORE_UNAVAILABLE, "Policy store unavailable");
        }
        return evaluate(assessment.getContext(), assessment, policies);
    }

    private List<AccessPolicy> seedDefaults() {
        try {
            seeder.seedIfEmpty();
        } catch (RuntimeException e) {
            // a concurrent seeder may have won the unique-name race
            log.warn("Seeding default policies failed, re-reading policy store: {}", e.getMessage());
        }
        return policyStore.findEnabled();
    }

    /**
     * Pure resolution over the given policies; disabled ones are skipped.
     */
    public Decision evaluate(AuthContext context, RiskAssessment assessment, List<AccessPolicy> policies) {
        double score = assessment.getTotalScore();
        List<AccessPolicy> ordered = policies.stream()
                .filter(AccessPolicy::isEnabled)
                .sorted(EVALUATION_ORDER)
                .collect(Collectors.toList());
        for (AccessPolicy policy : ordered) {
            if (policy.matches(context, score)) {
                log.debug("Policy matched: user={}, policy={}, priority={}, action={}",
                        context.getUserId(), policy.getName(), policy.getPriority(), policy.getAction());
                return Decision.matched(policy.getAction(), policy.getName(), policy.getDescription());
            }
        }
        log.info("No policy matched for user={} score={}; applying default allow", context.getUserId(), score);
        return Decision.defaultAllow();
    }
}
