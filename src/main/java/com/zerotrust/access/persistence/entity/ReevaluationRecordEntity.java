package com.zerotrust.access.persistence.entity;

import com.zerotrust.access.domain.ReevaluationAction;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "session_reevaluations", indexes = {
    @Index(name = "idx_reevaluation_session_time", columnList = "session_id, reevaluated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReevaluationRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "previous_score", nullable = false)
    private double previousScore;

    @Column(name = "current_score", nullable = false)
    private double currentScore;

    @Column(name = "delta", nullable = false)
    private double delta;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "factor_scores", columnDefinition = "TEXT")
    private Map<String, Object> factorScores;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "anomalies", columnDefinition = "TEXT")
    private List<Map<String, Object>> anomalies;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20)
    private ReevaluationAction action;

    @Column(name = "reevaluated_at", nullable = false)
    private Instant reevaluatedAt;
}
