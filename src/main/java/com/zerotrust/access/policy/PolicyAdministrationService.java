package com.zerotrust.access.policy;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.SecurityAuditLogger;
import com.zerotrust.access.domain.PolicyAction;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Administrative operations on the policy set. Every write is validated in full
 * before the store is touched; a {@link PolicyValidationException} means nothing
 * was changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAdministrationService {

    private final PolicyStore policyStore;
    private final Validator validator;
    private final AuditTrail auditTrail;
    private final SecurityAuditLogger securityAuditLogger;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<AccessPolicy> listPolicies() {
        return policyStore.findAll().stream()
                .sorted(PolicyResolver.EVALUATION_ORDER)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public AccessPolicy getPolicy(String policyId) {
        return policyStore.findById(policyId).orElseThrow(() -> new PolicyNotFoundException(policyId));
    }

    @Transactional
    public AccessPolicy createPolicy(PolicyCommand command, String actorId) {
        AccessPolicy policy = validateNew(command);
        AccessPolicy saved = policyStore.save(policy);
        audit(AuditEventType.POLICY_CREATED, saved, actorId);
        return saved;
    }

    /**
     * Inserts the policy at the command's priority, first moving every existing
     * policy at or above that priority down by one, in the same transaction.
     */
    @Transactional
    public AccessPolicy createWithTopPriority(PolicyCommand command, String actorId) {
        AccessPolicy policy = validateNew(command);
        int shifted = policyStore.shiftPrioritiesFrom(policy.getPriority());
        log.info("Shifted {} policies to make room at priority {} for {}", shifted, policy.getPriority(), policy.getName());
        AccessPolicy saved = policyStore.save(policy);
        audit(AuditEventType.POLICY_CREATED, saved, actorId);
        return saved;
    }

    @Transactional
    public AccessPolicy updatePolicy(String policyId, PolicyUpdate update, String actorId) {
        AccessPolicy existing = getPolicy(policyId);
        List<String> violations = new ArrayList<>();
        AccessPolicy.AccessPolicyBuilder builder = existing.toBuilder();

        if (update.getName() != null) {
            String name = update.getName().trim();
            if (name.isEmpty() || name.length() > 100) {
                violations.add("name must be 1 to 100 characters");
            } else if (!name.equals(existing.getName()) && policyStore.existsByName(name)) {
                violations.add("policy name '" + name + "' already exists");
            }
            builder.name(name);
        }
        if (update.getAction() != null) {
            PolicyAction action = PolicyAction.fromValue(update.getAction()).orElse(null);
            if (action == null) {
                violations.add("action must be one of allow, stepup, deny");
            }
            builder.action(action);
        }
        if (update.getConditions() != null) {
            try {
                builder.predicates(PolicyPredicates.fromConditions(update.getConditions()));
            } catch (PolicyValidationException e) {
                violations.addAll(e.getViolations());
            }
        }
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(violations);
        }
        if (update.getDescription() != null) builder.description(update.getDescription());
        if (update.getPriority() != null) builder.priority(update.getPriority());
        if (update.getEnabled() != null) builder.enabled(update.getEnabled());

        AccessPolicy saved = policyStore.save(builder.updatedAt(clock.instant()).build());
        audit(AuditEventType.POLICY_UPDATED, saved, actorId);
        return saved;
    }

    @Transactional
    public void deletePolicy(String policyId, String actorId) {
        AccessPolicy existing = getPolicy(policyId);
        policyStore.deleteById(policyId);
        audit(AuditEventType.POLICY_DELETED, existing, actorId);
    }

    @Transactional
    public AccessPolicy togglePolicy(String policyId, String actorId) {
        AccessPolicy existing = getPolicy(policyId);
        AccessPolicy saved = policyStore.save(existing.toBuilder()
                .enabled(!existing.isEnabled())
                .updatedAt(clock.instant())
                .build());
        audit(AuditEventType.POLICY_TOGGLED, saved, actorId);
        return saved;
    }

    private AccessPolicy validateNew(PolicyCommand command) {
        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<PolicyCommand> v : validator.validate(command)) {
            violations.add(v.getPropertyPath() + " " + v.getMessage());
        }
        List<PolicyPredicate> predicates = List.of();
        try {
            predicates = PolicyPredicates.fromConditions(command.getConditions());
        } catch (PolicyValidationException e) {
            violations.addAll(e.getViolations());
        }
        if (command.getName() != null && !command.getName().isBlank()
                && policyStore.existsByName(command.getName().trim())) {
            violations.add("policy name '" + command.getName().trim() + "' already exists");
        }
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(violations);
        }
        Instant now = clock.instant();
        return AccessPolicy.builder()
                .name(command.getName().trim())
                .description(command.getDescription())
                .priority(command.getPriority())
                .predicates(predicates)
                .action(PolicyAction.fromValue(command.getAction()).orElseThrow())
                .enabled(command.isEnabled())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void audit(AuditEventType type, AccessPolicy policy, String actorId) {
        securityAuditLogger.logPolicyChange(type, policy.getId(), policy.getName());
        auditTrail.record(AuditRecord.builder()
                .type(type)
                .userId(actorId)
                .detail("policyId", Objects.toString(policy.getId(), ""))
                .detail("policyName", policy.getName())
                .detail("priority", policy.getPriority())
                .detail("action", policy.getAction().value())
                .detail("enabled", policy.isEnabled())
                .occurredAt(clock.instant())
                .build());
    }
}
