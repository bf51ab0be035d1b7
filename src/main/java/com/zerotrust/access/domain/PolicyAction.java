package com.zerotrust.access.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Outcome a policy assigns to a matching attempt.
 */
public enum PolicyAction {
    ALLOW("allow"),
    STEPUP("stepup"),
    DENY("deny");

    private final String value;

    PolicyAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PolicyAction> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(a -> a.value.equals(normalized)).findFirst();
    }
}
