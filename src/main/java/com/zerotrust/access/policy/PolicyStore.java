package com.zerotrust.access.policy;

import java.util.List;
import java.util.Optional;

/**
 * Persistent policy set.
 */
public interface PolicyStore {

    List<AccessPolicy> findAll();

    List<AccessPolicy> findEnabled();

    Optional<AccessPolicy> findById(String id);

    boolean existsByName(String name);

    long count();

    AccessPolicy save(AccessPolicy policy);

    void deleteById(String id);

    /** Adds one to the priority of every policy at or above the given priority. */
    int shiftPrioritiesFrom(int priority);
}
