package com.zerotrust.access.risk.engine;

import com.zerotrust.access.domain.AuthContext;
import com.zerotrust.access.domain.DeviceSignature;
import com.zerotrust.access.domain.GeoLocation;
import com.zerotrust.access.domain.RiskAssessment;
import com.zerotrust.access.domain.RiskFactorType;
import com.zerotrust.access.domain.RiskLevel;
import com.zerotrust.access.risk.BusinessHours;
import com.zerotrust.access.risk.device.DeviceRegistry;
import com.zerotrust.access.risk.device.KnownDevice;
import com.zerotrust.access.risk.history.AuthHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RiskScorer: weighted aggregation over the five factor evaluators.
 */
@ExtendWith(MockitoExtension.class)
class RiskScorerTest {

    /** Wednesday 22:00 UTC. */
    private static final Instant WEEKDAY_NIGHT = Instant.parse("2024-03-13T22:00:00Z");

    @Mock
    private DeviceRegistry deviceRegistry;
    @Mock
    private AuthHistory authHistory;

    private final Clock clock = Clock.fixed(WEEKDAY_NIGHT, ZoneOffset.UTC);
    private RiskScorer riskScorer;

    @BeforeEach
    void setUp() {
        BusinessHours businessHours = new BusinessHours("UTC", 8, 18);
        riskScorer = new RiskScorer(List.of(
                new DeviceFactorEvaluator(deviceRegistry),
                new LocationFactorEvaluator(authHistory),
                new TimeFactorEvaluator(businessHours),
                new FailedAttemptsFactorEvaluator(authHistory),
                new VelocityFactorEvaluator(authHistory)), clock);
        lenient().when(authHistory.countFailedAttempts(anyString(), any())).thenReturn(0L);
        lenient().when(authHistory.countAuthAttempts(anyString(), any())).thenReturn(0L);
    }

    private static AuthContext context(String location) {
        return AuthContext.builder()
                .userId("user-1")
                .ipAddress("203.0.113.7")
                .device(DeviceSignature.builder()
                        .browserFamily("Chrome").osFamily("Windows").mobile(false)
                        .rawUserAgent("Mozilla/5.0 (Windows NT 10.0; Win64; x64) Chrome/120.0")
                        .build())
                .location(GeoLocation.named(location))
                .timestamp(WEEKDAY_NIGHT)
                .businessHours(false)
                .build();
    }

    @Test
    void unknownDeviceNewLocationOffHoursScoresTwentyThreeSeventyFive() {
        when(deviceRegistry.findDevice(eq("user-1"), anyString())).thenReturn(Optional.empty());
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Berlin, DE"));

        RiskAssessment assessment = riskScorer.evaluate(context("Paris, FR"));

        assertThat(assessment.getTotalScore()).isEqualTo(23.75);
        assertThat(assessment.getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(assessment.factor(RiskFactorType.DEVICE).getScore()).isEqualTo(40.0);
        assertThat(assessment.factor(RiskFactorType.LOCATION).getScore()).isEqualTo(35.0);
        assertThat(assessment.factor(RiskFactorType.TIME).getScore()).isEqualTo(15.0);
        assertThat(assessment.factor(RiskFactorType.FAILED_ATTEMPTS).getScore()).isZero();
        assertThat(assessment.factor(RiskFactorType.VELOCITY).getScore()).isZero();
        assertThat(assessment.getEvaluatedAt()).isEqualTo(WEEKDAY_NIGHT);
    }

    @Test
    void assessmentCarriesAllFiveFactorsInCanonicalOrder() {
        when(deviceRegistry.findDevice(eq("user-1"), anyString())).thenReturn(Optional.empty());
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of());

        RiskAssessment assessment = riskScorer.evaluate(context("Paris, FR"));

        assertThat(assessment.getFactors().keySet())
                .containsExactly("device", "location", "time", "failed_attempts", "velocity");
        double weights = assessment.getFactors().values().stream().mapToDouble(f -> f.getWeight()).sum();
        assertThat(weights).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void maximumFactorScoresStayInLowBand() {
        when(deviceRegistry.findDevice(eq("user-1"), anyString())).thenReturn(Optional.empty());
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Berlin, DE"));
        when(authHistory.countFailedAttempts(anyString(), any())).thenReturn(5L);
        when(authHistory.countAuthAttempts(anyString(), any())).thenReturn(9L);
        AuthContext saturday = context("Paris, FR").toBuilder()
                .timestamp(Instant.parse("2024-03-16T12:00:00Z"))
                .build();

        RiskAssessment assessment = riskScorer.evaluate(saturday);

        // 12 + 8.75 + 5 + 7.5 + 5
        assertThat(assessment.getTotalScore()).isEqualTo(38.25);
        assertThat(assessment.getLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void failingCollaboratorIsReplacedByNeutralScore() {
        when(deviceRegistry.findDevice(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Paris, FR"));

        RiskAssessment assessment = riskScorer.evaluate(context("Paris, FR"));

        assertThat(assessment.factor(RiskFactorType.DEVICE).getScore()).isZero();
        assertThat(assessment.factor(RiskFactorType.DEVICE).getDetail()).startsWith("unavailable");
        assertThat(assessment.getTotalScore()).isEqualTo(3.0);
    }

    @Test
    void neutralScoreIsConfigurable() {
        ReflectionTestUtils.setField(riskScorer, "neutralFactorScore", 50.0);
        when(deviceRegistry.findDevice(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Paris, FR"));

        RiskAssessment assessment = riskScorer.evaluate(context("Paris, FR"));

        assertThat(assessment.factor(RiskFactorType.DEVICE).getScore()).isEqualTo(50.0);
        assertThat(assessment.getTotalScore()).isEqualTo(18.0);
    }

    @Test
    void evaluatorThatThrowsDoesNotAbortEvaluation() {
        RiskFactorEvaluator broken = new RiskFactorEvaluator() {
            @Override
            public RiskFactorType type() {
                return RiskFactorType.DEVICE;
            }

            @Override
            public FactorEvaluation evaluate(AuthContext context) {
                throw new NullPointerException("boom");
            }
        };
        RiskScorer scorer = new RiskScorer(List.of(
                broken,
                new LocationFactorEvaluator(authHistory),
                new TimeFactorEvaluator(new BusinessHours("UTC", 8, 18)),
                new FailedAttemptsFactorEvaluator(authHistory),
                new VelocityFactorEvaluator(authHistory)), clock);
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Paris, FR"));

        RiskAssessment assessment = scorer.evaluate(context("Paris, FR"));

        assertThat(assessment.getFactors()).hasSize(5);
        assertThat(assessment.factor(RiskFactorType.DEVICE).getScore()).isZero();
    }

    @Test
    void knownDeviceScoresZero() {
        when(deviceRegistry.findDevice(eq("user-1"), anyString()))
                .thenReturn(Optional.of(KnownDevice.builder().userId("user-1").build()));
        when(authHistory.knownLocations("user-1")).thenReturn(Set.of("Paris, FR"));

        RiskAssessment assessment = riskScorer.evaluate(context("Paris, FR"));

        assertThat(assessment.factor(RiskFactorType.DEVICE).getScore()).isZero();
        assertThat(assessment.getTotalScore()).isEqualTo(3.0);
    }

    @Test
    void constructorRejectsMissingFactor() {
        assertThatThrownBy(() -> new RiskScorer(List.of(new DeviceFactorEvaluator(deviceRegistry)), clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No evaluator");
    }

    @Test
    void constructorRejectsDuplicateFactor() {
        assertThatThrownBy(() -> new RiskScorer(List.of(
                new DeviceFactorEvaluator(deviceRegistry),
                new DeviceFactorEvaluator(deviceRegistry)), clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
