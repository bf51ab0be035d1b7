package com.zerotrust.access.policy;

import com.zerotrust.access.domain.AuthContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The closed set of policy predicates and their conversion from and to the
 * stored condition map. Malformed conditions are rejected here, at construction.
 */
public final class PolicyPredicates {

    public static final String MIN_RISK_SCORE = "min_risk_score";
    public static final String MAX_RISK_SCORE = "max_risk_score";
    public static final String ALLOWED_COUNTRIES = "allowed_countries";
    public static final String BLOCKED_COUNTRIES = "blocked_countries";
    public static final String REQUIRED_LOCATION = "required_location";
    public static final String ALLOWED_DEVICES = "allowed_devices";
    public static final String BUSINESS_HOURS_ONLY = "business_hours_only";

    private PolicyPredicates() {
    }

    /** Inclusive lower bound on the total risk score. */
    public record MinRiskScore(double min) implements PolicyPredicate {
        public String key() { return MIN_RISK_SCORE; }
        public Object value() { return min; }
        public boolean test(AuthContext context, double riskScore) { return riskScore >= min; }
    }

    /** Inclusive upper bound on the total risk score. */
    public record MaxRiskScore(double max) implements PolicyPredicate {
        public String key() { return MAX_RISK_SCORE; }
        public Object value() { return max; }
        public boolean test(AuthContext context, double riskScore) { return riskScore <= max; }
    }

    /**
     * Holds when the resolved country is outside the allowed set, so the policy's
     * action applies to foreign (or unresolved) origins.
     */
    public record AllowedCountries(Set<String> countries) implements PolicyPredicate {
        public String key() { return ALLOWED_COUNTRIES; }
        public Object value() { return List.copyOf(countries); }
        public boolean test(AuthContext context, double riskScore) {
            String country = context.getCountryCode();
            return country == null || !countries.contains(country.toUpperCase(Locale.ROOT));
        }
    }

    /** Holds when the resolved country is in the blocked set. */
    public record BlockedCountries(Set<String> countries) implements PolicyPredicate {
        public String key() { return BLOCKED_COUNTRIES; }
        public Object value() { return List.copyOf(countries); }
        public boolean test(AuthContext context, double riskScore) {
            String country = context.getCountryCode();
            return country != null && countries.contains(country.toUpperCase(Locale.ROOT));
        }
    }

    public record RequiredLocation(String location) implements PolicyPredicate {
        public String key() { return REQUIRED_LOCATION; }
        public Object value() { return location; }
        public boolean test(AuthContext context, double riskScore) {
            return location.equals(context.getLocationDisplay());
        }
    }

    public record AllowedDevices(Set<String> deviceTypes) implements PolicyPredicate {
        public String key() { return ALLOWED_DEVICES; }
        public Object value() { return List.copyOf(deviceTypes); }
        public boolean test(AuthContext context, double riskScore) {
            String type = context.getDeviceType();
            return type != null && deviceTypes.contains(type);
        }
    }

    /** {@code required=false} is stored but vacuously satisfied. */
    public record BusinessHoursOnly(boolean required) implements PolicyPredicate {
        public String key() { return BUSINESS_HOURS_ONLY; }
        public Object value() { return required; }
        public boolean test(AuthContext context, double riskScore) {
            return !required || context.isBusinessHours();
        }
    }

    public static List<PolicyPredicate> fromConditions(Map<String, ?> conditions) {
        List<PolicyPredicate> predicates = new ArrayList<>();
        if (conditions == null || conditions.isEmpty()) {
            return predicates;
        }
        List<String> violations = new ArrayList<>();
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            String key = entry.getKey();
            Object raw = entry.getValue();
            try {
                predicates.add(parse(key, raw));
            } catch (IllegalArgumentException e) {
                violations.add(e.getMessage());
            }
        }
        Double min = null;
        Double max = null;
        for (PolicyPredicate p : predicates) {
            if (p instanceof MinRiskScore) min = ((MinRiskScore) p).min();
            if (p instanceof MaxRiskScore) max = ((MaxRiskScore) p).max();
        }
        if (min != null && max != null && min > max) {
            violations.add(MIN_RISK_SCORE + " (" + min + ") is greater than " + MAX_RISK_SCORE + " (" + max + ")");
        }
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(violations);
        }
        return predicates;
    }

    public static Map<String, Object> toConditions(Collection<PolicyPredicate> predicates) {
        Map<String, Object> conditions = new LinkedHashMap<>();
        for (PolicyPredicate predicate : predicates) {
            conditions.put(predicate.key(), predicate.value());
        }
        return conditions;
    }

    private static PolicyPredicate parse(String key, Object raw) {
        if (key == null) {
            throw new IllegalArgumentException("condition key must not be null");
        }
        switch (key) {
            case MIN_RISK_SCORE:
                return new MinRiskScore(score(key, raw));
            case MAX_RISK_SCORE:
                return new MaxRiskScore(score(key, raw));
            case ALLOWED_COUNTRIES:
                return new AllowedCountries(countries(key, raw));
            case BLOCKED_COUNTRIES:
                return new BlockedCountries(countries(key, raw));
            case REQUIRED_LOCATION:
                if (!(raw instanceof String) || ((String) raw).isBlank()) {
                    throw new IllegalArgumentException(key + " must be a non-empty string");
                }
                return new RequiredLocation((String) raw);
            case ALLOWED_DEVICES:
                return new AllowedDevices(strings(key, raw, false));
            case BUSINESS_HOURS_ONLY:
                if (!(raw instanceof Boolean)) {
                    throw new IllegalArgumentException(key + " must be a boolean");
                }
                return new BusinessHoursOnly((Boolean) raw);
            default:
                throw new IllegalArgumentException("unknown condition " + key);
        }
    }

    private static double score(String key, Object raw) {
        if (!(raw instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number");
        }
        double value = ((Number) raw).doubleValue();
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(key + " must be between 0 and 100");
        }
        return value;
    }

    private static Set<String> countries(String key, Object raw) {
        return strings(key, raw, true);
    }

    private static Set<String> strings(String key, Object raw, boolean upperCase) {
        if (!(raw instanceof Collection)) {
            throw new IllegalArgumentException(key + " must be a list of strings");
        }
        Set<String> values = new LinkedHashSet<>();
        for (Object item : (Collection<?>) raw) {
            if (!(item instanceof String) || ((String) item).isBlank()) {
                throw new IllegalArgumentException(key + " must contain only non-empty strings");
            }
            String s = ((String) item).trim();
            values.add(upperCase ? s.toUpperCase(Locale.ROOT) : s);
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
        return Set.copyOf(values);
    }
}
