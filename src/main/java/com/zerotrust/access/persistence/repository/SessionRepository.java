package com.zerotrust.access.persistence.repository;

import com.zerotrust.access.persistence.entity.SessionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SessionRepository extends JpaRepository<SessionEntity, String> {

    @Query("SELECT s.id FROM SessionEntity s WHERE s.revoked = false AND s.expiresAt > :now " +
            "AND s.riskScore >= :threshold ORDER BY s.riskScore DESC")
    List<String> findActiveIdsAtOrAbove(@Param("threshold") double threshold, @Param("now") Instant now);

    @Query("SELECT s.id FROM SessionEntity s WHERE s.revoked = false AND s.expiresAt > :now " +
            "AND (s.nextReevaluationAt IS NULL OR s.nextReevaluationAt <= :now) ORDER BY s.nextReevaluationAt ASC")
    List<String> findDueIds(@Param("now") Instant now, Pageable pageable);
}
