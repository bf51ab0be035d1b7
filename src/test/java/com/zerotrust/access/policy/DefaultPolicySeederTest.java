package com.zerotrust.access.policy;

import com.zerotrust.access.domain.PolicyAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultPolicySeederTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:00Z");

    @Mock
    private PolicyStore policyStore;

    private DefaultPolicySeeder seeder;

    @BeforeEach
    void setUp() {
        seeder = new DefaultPolicySeeder(policyStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void seedsThreeBandsWhenEmpty() {
        when(policyStore.count()).thenReturn(0L);

        assertThat(seeder.seedIfEmpty()).isTrue();

        ArgumentCaptor<AccessPolicy> saved = ArgumentCaptor.forClass(AccessPolicy.class);
        verify(policyStore, times(3)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(AccessPolicy::getName).containsExactly(
                DefaultPolicySeeder.HIGH_RISK_DENY, DefaultPolicySeeder.MEDIUM_RISK_STEPUP, DefaultPolicySeeder.LOW_RISK_ALLOW);
        assertThat(saved.getAllValues()).extracting(AccessPolicy::getAction).containsExactly(
                PolicyAction.DENY, PolicyAction.STEPUP, PolicyAction.ALLOW);
        assertThat(saved.getAllValues()).extracting(AccessPolicy::getPriority).containsExactly(1, 2, 3);
    }

    @Test
    void doesNothingWhenAnyPolicyExists() {
        when(policyStore.count()).thenReturn(1L);

        assertThat(seeder.seedIfEmpty()).isFalse();
        verify(policyStore, never()).save(any());
    }

    @Test
    void startupSeedingSurvivesStoreFailure() {
        when(policyStore.count()).thenThrow(new IllegalStateException("database starting up"));

        assertThatCode(seeder::seedOnStartup).doesNotThrowAnyException();
    }
}
