package com.zerotrust.access.persistence.service;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.audit.AuditRecord;
import com.zerotrust.access.audit.AuditTrail;
import com.zerotrust.access.audit.ReevaluationRecord;
import com.zerotrust.access.domain.Anomaly;
import com.zerotrust.access.persistence.entity.AuditEventEntity;
import com.zerotrust.access.persistence.entity.ReevaluationRecordEntity;
import com.zerotrust.access.persistence.repository.AuditEventRepository;
import com.zerotrust.access.persistence.repository.ReevaluationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Audit events and reevaluation records in PostgreSQL. Writes run in their own
 * transaction so a failed audit write cannot roll back the caller's work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaAuditTrail implements AuditTrail {

    private final AuditEventRepository auditEventRepository;
    private final ReevaluationRecordRepository reevaluationRecordRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditRecord record) {
        try {
            auditEventRepository.save(AuditEventEntity.builder()
                    .eventType(record.getType())
                    .userId(record.getUserId())
                    .sessionId(record.getSessionId())
                    .ipAddress(record.getIpAddress())
                    .userAgent(record.getUserAgent())
                    .details(record.getDetails().isEmpty() ? null : new LinkedHashMap<>(record.getDetails()))
                    .occurredAt(record.getOccurredAt() != null ? record.getOccurredAt() : Instant.now())
                    .build());
            log.debug("Persisted audit event: type={}, userId={}, sessionId={}",
                    record.getType(), record.getUserId(), record.getSessionId());
        } catch (Exception e) {
            log.error("Failed to persist audit event: type={}, userId={}", record.getType(), record.getUserId(), e);
            // Don't throw - audit failure shouldn't break the access flow
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordReevaluation(ReevaluationRecord record) {
        try {
            reevaluationRecordRepository.save(ReevaluationRecordEntity.builder()
                    .sessionId(record.getSessionId())
                    .userId(record.getUserId())
                    .previousScore(record.getPreviousScore())
                    .currentScore(record.getCurrentScore())
                    .delta(record.getDelta())
                    .factorScores(record.getFactorScores() != null ? new LinkedHashMap<String, Object>(record.getFactorScores()) : null)
                    .anomalies(anomalies(record.getAnomalies()))
                    .action(record.getAction())
                    .reevaluatedAt(record.getReevaluatedAt())
                    .build());
            log.debug("Persisted reevaluation: sessionId={}, action={}", record.getSessionId(), record.getAction());
        } catch (Exception e) {
            log.error("Failed to persist reevaluation: sessionId={}", record.getSessionId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countByIpAddress(String ipAddress, Set<AuditEventType> types, Instant since) {
        return auditEventRepository.countByIpAddress(ipAddress, types, since);
    }

    private static List<Map<String, Object>> anomalies(List<Anomaly> anomalies) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (anomalies == null) return rows;
        for (Anomaly anomaly : anomalies) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("type", anomaly.getType().name());
            row.put("description", anomaly.getDescription());
            row.put("magnitude", anomaly.getMagnitude());
            rows.add(row);
        }
        return rows;
    }
}
