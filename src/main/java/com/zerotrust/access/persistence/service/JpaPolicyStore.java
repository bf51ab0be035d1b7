package com.zerotrust.access.persistence.service;

import com.zerotrust.access.domain.PolicyAction;
import com.zerotrust.access.persistence.entity.PolicyEntity;
import com.zerotrust.access.persistence.repository.PolicyRepository;
import com.zerotrust.access.policy.AccessPolicy;
import com.zerotrust.access.policy.PolicyPredicates;
import com.zerotrust.access.policy.PolicyStore;
import com.zerotrust.access.policy.PolicyValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Policy set in PostgreSQL. Conditions are kept as a JSON object and parsed back
 * into predicates on every read. Invalid conditions throw {@code PolicyValidationException}
 * and an unknown action throws {@code IllegalStateException}, except in {@link #findEnabled()},
 * which skips such rows so the readable policies still resolve.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPolicyStore implements PolicyStore {

    private final PolicyRepository policyRepository;

    @Override
    @Transactional(readOnly = true)
    public List<AccessPolicy> findAll() {
        return policyRepository.findAll().stream().map(JpaPolicyStore::toDomain).collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccessPolicy> findEnabled() {
        List<AccessPolicy> policies = new ArrayList<>();
        for (PolicyEntity entity : policyRepository.findByEnabledTrue()) {
            try {
                policies.add(toDomain(entity));
            } catch (PolicyValidationException | IllegalStateException e) {
                log.warn("Skipping unreadable policy: id={}, name={}: {}", entity.getId(), entity.getName(), e.getMessage());
            }
        }
        return policies;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AccessPolicy> findById(String id) {
        return policyRepository.findById(id).map(JpaPolicyStore::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByName(String name) {
        return policyRepository.existsByName(name);
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return policyRepository.count();
    }

    @Override
    @Transactional
    public AccessPolicy save(AccessPolicy policy) {
        PolicyEntity saved = policyRepository.save(toEntity(policy));
        log.debug("Persisted policy: id={}, name={}, priority={}", saved.getId(), saved.getName(), saved.getPriority());
        return toDomain(saved);
    }

    @Override
    @Transactional
    public void deleteById(String id) {
        policyRepository.deleteById(id);
    }

    @Override
    @Transactional
    public int shiftPrioritiesFrom(int priority) {
        return policyRepository.shiftPrioritiesFrom(priority);
    }

    static PolicyEntity toEntity(AccessPolicy policy) {
        return PolicyEntity.builder()
                .id(policy.getId() != null ? policy.getId() : UUID.randomUUID().toString())
                .name(policy.getName())
                .description(policy.getDescription())
                .conditions(PolicyPredicates.toConditions(policy.getPredicates() != null ? policy.getPredicates() : List.of()))
                .action(policy.getAction().value())
                .priority(policy.getPriority())
                .enabled(policy.isEnabled())
                .createdAt(policy.getCreatedAt())
                .updatedAt(policy.getUpdatedAt())
                .build();
    }

    static AccessPolicy toDomain(PolicyEntity entity) {
        PolicyAction action = PolicyAction.fromValue(entity.getAction())
                .orElseThrow(() -> new IllegalStateException(
                        "Policy " + entity.getId() + " has unknown action " + entity.getAction()));
        return AccessPolicy.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .predicates(PolicyPredicates.fromConditions(entity.getConditions()))
                .action(action)
                .priority(entity.getPriority())
                .enabled(entity.isEnabled())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
