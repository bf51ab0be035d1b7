package com.zerotrust.access.policy;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.domain.GeoLocation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyPredicatesTest {

    private static AuthContext context(String country, String display, boolean mobile, boolean businessHours) {
        return AuthContext.builder()
                .userId("user-1")
                .location(GeoLocation.builder().countryCode(country).display(display).build())
                .device(DeviceSignature.builder().browserFamily("Safari").osFamily("iOS").mobile(mobile)
                        .rawUserAgent("ua").build())
                .businessHours(businessHours)
                .build();
    }

    private static boolean holds(Map<String, Object> conditions, AuthContext context, double score) {
        return AccessPolicy.builder()
                .predicates(PolicyPredicates.fromConditions(conditions))
                .build()
                .matches(context, score);
    }

    @Test
    void scoreBoundsAreInclusive() {
        AuthContext ctx = context("US", "Austin, US", false, true);
        Map<String, Object> band = Map.of(PolicyPredicates.MIN_RISK_SCORE, 40, PolicyPredicates.MAX_RISK_SCORE, 74);

        assertThat(holds(band, ctx, 40)).isTrue();
        assertThat(holds(band, ctx, 74)).isTrue();
        assertThat(holds(band, ctx, 39.99)).isFalse();
        assertThat(holds(band, ctx, 74.01)).isFalse();
    }

    @Test
    void allowedCountriesHoldsOutsideTheListAndWhenUnresolved() {
        Map<String, Object> conditions = Map.of(PolicyPredicates.ALLOWED_COUNTRIES, List.of("ar", "BR"));

        assertThat(holds(conditions, context("US", "Austin, US", false, true), 0)).isTrue();
        assertThat(holds(conditions, context("AR", "Cordoba, AR", false, true), 0)).isFalse();
        assertThat(holds(conditions, context(null, "Unknown", false, true), 0)).isTrue();
    }

    @Test
    void blockedCountriesHoldsOnlyInsideTheList() {
        Map<String, Object> conditions = Map.of(PolicyPredicates.BLOCKED_COUNTRIES, List.of("KP"));

        assertThat(holds(conditions, context("KP", "Pyongyang, KP", false, true), 0)).isTrue();
        assertThat(holds(conditions, context("US", "Austin, US", false, true), 0)).isFalse();
        assertThat(holds(conditions, context(null, "Unknown", false, true), 0)).isFalse();
    }

    @Test
    void locationDeviceAndHoursPredicates() {
        AuthContext mobileInParisAfterHours = context("FR", "Paris, FR", true, false);

        assertThat(holds(Map.of(PolicyPredicates.REQUIRED_LOCATION, "Paris, FR"), mobileInParisAfterHours, 0)).isTrue();
        assertThat(holds(Map.of(PolicyPredicates.REQUIRED_LOCATION, "Lyon, FR"), mobileInParisAfterHours, 0)).isFalse();
        assertThat(holds(Map.of(PolicyPredicates.ALLOWED_DEVICES, List.of("mobile")), mobileInParisAfterHours, 0)).isTrue();
        assertThat(holds(Map.of(PolicyPredicates.ALLOWED_DEVICES, List.of("desktop")), mobileInParisAfterHours, 0)).isFalse();
        assertThat(holds(Map.of(PolicyPredicates.BUSINESS_HOURS_ONLY, true), mobileInParisAfterHours, 0)).isFalse();
        assertThat(holds(Map.of(PolicyPredicates.BUSINESS_HOURS_ONLY, false), mobileInParisAfterHours, 0)).isTrue();
    }

    @Test
    void emptyConditionsAlwaysMatch() {
        assertThat(holds(Map.of(), context("US", "Austin, US", false, true), 99)).isTrue();
    }

    @Test
    void rejectsMalformedConditionsWithEveryViolation() {
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put("max_risk", 10);
        conditions.put(PolicyPredicates.MIN_RISK_SCORE, 140);
        conditions.put(PolicyPredicates.ALLOWED_COUNTRIES, "US");
        conditions.put(PolicyPredicates.BUSINESS_HOURS_ONLY, "yes");

        assertThatThrownBy(() -> PolicyPredicates.fromConditions(conditions))
                .isInstanceOfSatisfying(PolicyValidationException.class, e -> assertThat(e.getViolations()).hasSize(4));
    }

    @Test
    void rejectsInvertedScoreBand() {
        assertThatThrownBy(() -> PolicyPredicates.fromConditions(
                Map.of(PolicyPredicates.MIN_RISK_SCORE, 80, PolicyPredicates.MAX_RISK_SCORE, 20)))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("greater than");
    }

    @Test
    void rejectsEmptyCountryList() {
        assertThatThrownBy(() -> PolicyPredicates.fromConditions(Map.of(PolicyPredicates.BLOCKED_COUNTRIES, List.of())))
                .isInstanceOf(PolicyValidationException.class);
    }

    @Test
    void conditionsSurviveConversionBackToMap() {
        Map<String, Object> conditions = Map.of(
                PolicyPredicates.MIN_RISK_SCORE, 40,
                PolicyPredicates.ALLOWED_COUNTRIES, List.of("us"));

        Map<String, Object> stored = PolicyPredicates.toConditions(PolicyPredicates.fromConditions(conditions));

        assertThat(stored).containsEntry(PolicyPredicates.MIN_RISK_SCORE, 40.0)
                .containsEntry(PolicyPredicates.ALLOWED_COUNTRIES, List.of("US"));
    }
}
