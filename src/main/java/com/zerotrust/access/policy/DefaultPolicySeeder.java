package com.zerotrust.access.policy;

import com.zerotrust.access.domain.PolicyAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Seeds the three score-band policies when the policy store holds no policy at all.
 * Runs at startup and again on first resolution if the store was still empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultPolicySeeder {

    public static final String HIGH_RISK_DENY = "high_risk_deny";
    public static final String MEDIUM_RISK_STEPUP = "medium_risk_stepup";
    public static final String LOW_RISK_ALLOW = "low_risk_allow";

    private final PolicyStore policyStore;
    private final Clock clock;

    public static List<AccessPolicy> defaultPolicies(Instant now) {
        return List.of(
                policy(HIGH_RISK_DENY, "Deny access when risk is high",
                        Map.of(PolicyPredicates.MIN_RISK_SCORE, 75), PolicyAction.DENY, 1, now),
                policy(MEDIUM_RISK_STEPUP, "Require additional verification for medium risk",
                        Map.of(PolicyPredicates.MIN_RISK_SCORE, 40, PolicyPredicates.MAX_RISK_SCORE, 74),
                        PolicyAction.STEPUP, 2, now),
                policy(LOW_RISK_ALLOW, "Allow access when risk is low",
                        Map.of(PolicyPredicates.MAX_RISK_SCORE, 39), PolicyAction.ALLOW, 3, now));
    }

    /**
     * @return true if the defaults were written by this call
     */
    @Transactional
    public boolean seedIfEmpty() {
        if (policyStore.count() > 0) {
            return false;
        }
        for (AccessPolicy policy : defaultPolicies(clock.instant())) {
            policyStore.save(policy);
        }
        log.info("Policy store was empty; seeded default policies {}, {}, {}",
                HIGH_RISK_DENY, MEDIUM_RISK_STEPUP, LOW_RISK_ALLOW);
        return true;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedOnStartup() {
        try {
            seedIfEmpty();
        } catch (Exception e) {
            log.warn("Could not seed default policies at startup, will retry on first evaluation: {}", e.getMessage());
        }
    }

    private static AccessPolicy policy(String name, String description, Map<String, Object> conditions,
                                       PolicyAction action, int priority, Instant now) {
        return AccessPolicy.builder()
                .name(name)
                .description(description)
                .predicates(PolicyPredicates.fromConditions(conditions))
                .action(action)
                .priority(priority)
                .enabled(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
