package com.zerotrust.access.persistence.repository;

import com.zerotrust.access.audit.AuditEventType;
import com.zerotrust.access.persistence.entity.AuditEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, String> {

    @Query("SELECT COUNT(e) FROM AuditEventEntity e WHERE e.userId = :userId " +
            "AND e.eventType IN :types AND e.occurredAt >= :since")
    long countByUser(@Param("userId") String userId,
                     @Param("types") Collection<AuditEventType> types,
                     @Param("since") Instant since);

    @Query("SELECT COUNT(e) FROM AuditEventEntity e WHERE e.ipAddress = :ipAddress " +
            "AND e.eventType IN :types AND e.occurredAt >= :since")
    long countByIpAddress(@Param("ipAddress") String ipAddress,
                          @Param("types") Collection<AuditEventType> types,
                          @Param("since") Instant since);

    @Query("SELECT e.occurredAt FROM AuditEventEntity e WHERE e.userId = :userId " +
            "AND e.eventType = :type AND e.occurredAt >= :since")
    List<Instant> findOccurrences(@Param("userId") String userId,
                                  @Param("type") AuditEventType type,
                                  @Param("since") Instant since);
}
