package com.zerotrust.access.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @ParameterizedTest
    @CsvSource({
            "0, LOW",
            "39.99, LOW",
            "40, MEDIUM",
            "74.99, MEDIUM",
            "75, HIGH",
            "100, HIGH"
    })
    void bandsByScore(double score, RiskLevel expected) {
        assertThat(RiskLevel.fromScore(score)).isEqualTo(expected);
    }
}
