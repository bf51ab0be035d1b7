package com.zerotrust.access.persistence.repository;

import com.zerotrust.access.persistence.entity.ReevaluationRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReevaluationRecordRepository extends JpaRepository<ReevaluationRecordEntity, String> {
}
