package com.zerotrust.access.policy;

import lombok.Getter;

import java.util.List;

/**
 * A policy write was rejected before any mutation. Carries every violation found.
 */
@Getter
public class PolicyValidationException extends RuntimeException {

    private final List<String> violations;

    public PolicyValidationException(List<String> violations) {
        super("Invalid policy: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public PolicyValidationException(String violation) {
        this(List.of(violation));
    }
}
