package com.zerotrust.access.persistence.entity;

import com.zerotrust.access.audit.AuditEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_user_type_time", columnList = "user_id, event_type, occurred_at"),
    @Index(name = "idx_audit_ip_type_time", columnList = "ip_address, event_type, occurred_at"),
    @Index(name = "idx_audit_session_id", columnList = "session_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private AuditEventType eventType;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "details", columnDefinition = "TEXT")
    private Map<String, Object> details;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;
}
